package com.raditha.formscope.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the candidate sub-expressions of a complex expression: innermost
 * parenthesized spans, then the operands of {@code and}/{@code or}.
 */
public class SubExpressionExtractor {

    private static final Pattern INNERMOST_PARENS = Pattern.compile("\\(([^()]+)\\)");
    private static final String AND = " and ";
    private static final String OR = " or ";

    /**
     * Extract candidates in order. None is empty and none equals the whole
     * expression.
     */
    public List<String> extract(String expression) {
        List<String> candidates = new ArrayList<>();

        Matcher matcher = INNERMOST_PARENS.matcher(expression);
        while (matcher.find()) {
            String inner = matcher.group(1).trim();
            if (!inner.isEmpty() && !inner.equals(expression)) {
                candidates.add(inner);
            }
        }

        if (expression.contains(AND) || expression.contains(OR)) {
            splitLogicalExpression(expression).stream()
                    .filter(part -> !part.equals(expression))
                    .forEach(candidates::add);
        }

        return candidates;
    }

    /**
     * Split on " and ", then each part on " or "; trimmed, non-empty, distinct.
     */
    static List<String> splitLogicalExpression(String expression) {
        List<String> parts = new ArrayList<>();

        for (String andPart : expression.split(Pattern.quote(AND))) {
            Arrays.stream(andPart.split(Pattern.quote(OR)))
                    .map(String::trim)
                    .filter(p -> !p.isEmpty())
                    .forEach(parts::add);
        }

        return parts.stream().distinct().toList();
    }
}
