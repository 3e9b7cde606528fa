package com.raditha.formscope.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts literal constants from an expression.
 * Double-quoted strings come first, then single-quoted strings, then numbers.
 */
public class ConstantExtractor {

    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'([^']*)'");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");

    /**
     * Extract constants, keeping the first occurrence of each value.
     *
     * @param expression Expression text
     * @return Distinct constants in extraction order
     */
    public List<String> extract(String expression) {
        Set<String> constants = new LinkedHashSet<>();

        collect(DOUBLE_QUOTED, expression, 1, constants);
        collect(SINGLE_QUOTED, expression, 1, constants);
        collect(NUMBER, expression, 0, constants);

        return new ArrayList<>(constants);
    }

    private void collect(Pattern pattern, String expression, int group, Set<String> into) {
        Matcher matcher = pattern.matcher(expression);
        while (matcher.find()) {
            into.add(matcher.group(group));
        }
    }
}
