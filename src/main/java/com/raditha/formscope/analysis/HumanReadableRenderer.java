package com.raditha.formscope.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paraphrases an expression in plain language.
 * Field references become bracketed display names, common function idioms
 * become sentences and operators become words. Never throws: on failure the
 * original text is returned.
 */
public class HumanReadableRenderer {
    private static final Logger logger = LoggerFactory.getLogger(HumanReadableRenderer.class);

    private static final String FIELD_PREFIX = "my:";

    private record Template(Pattern pattern, String replacement) {
    }

    private static final List<Template> TEMPLATES = List.of(
            new Template(Pattern.compile("string-length\\(([^)]+)\\)\\s*>\\s*0"), "$1 is not empty"),
            new Template(Pattern.compile("string-length\\(([^)]+)\\)\\s*=\\s*0"), "$1 is empty"),
            new Template(Pattern.compile("count\\(([^)]+)\\)\\s*>\\s*(\\d+)"), "$1 has more than $2 items"),
            new Template(Pattern.compile("count\\(([^)]+)\\)\\s*=\\s*(\\d+)"), "$1 has exactly $2 items"),
            new Template(Pattern.compile("sum\\(([^)]+)\\)"), "sum of $1"),
            new Template(Pattern.compile("concat\\(([^)]+)\\)"), "combine $1"));

    private static final String[][] CONNECTORS = {
            { " and ", " AND " },
            { " or ", " OR " }
    };

    // Legacy order: single-character operators run before >= and <=
    private static final String[][] LEGACY_OPERATORS = {
            { "!=", " is not equal to " },
            { "=", " equals " },
            { ">", " is greater than " },
            { "<", " is less than " },
            { ">=", " is greater than or equal to " },
            { "<=", " is less than or equal to " }
    };

    private static final String[][] ORDERED_OPERATORS = {
            { "!=", " is not equal to " },
            { ">=", " is greater than or equal to " },
            { "<=", " is less than or equal to " },
            { "=", " equals " },
            { ">", " is greater than " },
            { "<", " is less than " }
    };

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean fixOperatorOrdering;

    public HumanReadableRenderer() {
        this(false);
    }

    public HumanReadableRenderer(boolean fixOperatorOrdering) {
        this.fixOperatorOrdering = fixOperatorOrdering;
    }

    /**
     * Render an expression in plain language.
     *
     * @param expression       Original expression text
     * @param referencedFields Field paths referenced by the expression
     * @return Paraphrase, or the original expression if rendering fails
     */
    public String render(String expression, List<String> referencedFields) {
        try {
            return substitute(expression, referencedFields);
        } catch (RuntimeException e) {
            logger.debug("Falling back to original text for '{}': {}", expression, e.getMessage());
            return expression;
        }
    }

    private String substitute(String expression, List<String> referencedFields) {
        String readable = expression;

        // Longest paths first so my:a does not clobber my:ab
        List<String> fields = referencedFields.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        for (String field : fields) {
            readable = readable.replace(FIELD_PREFIX + field, "[" + displayName(field) + "]");
        }

        for (Template template : TEMPLATES) {
            readable = template.pattern().matcher(readable).replaceAll(template.replacement());
        }

        for (String[] connector : CONNECTORS) {
            readable = readable.replace(connector[0], connector[1]);
        }

        for (String[] operator : fixOperatorOrdering ? ORDERED_OPERATORS : LEGACY_OPERATORS) {
            readable = readable.replace(operator[0], operator[1]);
        }

        return WHITESPACE.matcher(readable).replaceAll(" ").trim();
    }

    /**
     * Last path segment of a field reference, without a namespace prefix.
     */
    static String displayName(String field) {
        String name = field.contains("/") ? field.substring(field.lastIndexOf('/') + 1) : field;
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
