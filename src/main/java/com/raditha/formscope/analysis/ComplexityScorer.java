package com.raditha.formscope.analysis;

import com.raditha.formscope.expression.FunctionCall;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores how hard an expression will be to migrate.
 * <p>
 * Score: +1 per field reference, +2 per function call, +3 per unknown
 * function call, +5 for nested parentheses, +4 for conditional logic and +3
 * for data lookups.
 */
public class ComplexityScorer {

    private static final int FIELD_WEIGHT = 1;
    private static final int FUNCTION_WEIGHT = 2;
    private static final int UNKNOWN_FUNCTION_WEIGHT = 3;
    private static final int NESTING_WEIGHT = 5;
    private static final int CONDITIONAL_WEIGHT = 4;
    private static final int LOOKUP_WEIGHT = 3;

    private static final Set<String> LOOKUP_FUNCTIONS = Set.of("user", "username", "useremail", "role");
    private static final List<String> CONDITIONAL_TOKENS = List.of(" and ", " or ", "if(", "choose(", "not(");

    private final int threshold;

    /**
     * @param threshold expressions scoring strictly above this are complex
     */
    public ComplexityScorer(int threshold) {
        this.threshold = threshold;
    }

    /**
     * Complexity of an expression.
     *
     * @param score               Total score
     * @param complex             Score strictly above the threshold
     * @param nestedConditions    Parentheses nest more than one level
     * @param requiresDataLookup  Expression depends on looked-up data
     */
    public record Complexity(int score, boolean complex, boolean nestedConditions, boolean requiresDataLookup) {
    }

    public Complexity score(String expression, List<String> referencedFields, List<FunctionCall> functionCalls) {
        int score = referencedFields.size() * FIELD_WEIGHT;
        score += functionCalls.size() * FUNCTION_WEIGHT;
        score += (int) functionCalls.stream().filter(f -> !f.knownFunction()).count() * UNKNOWN_FUNCTION_WEIGHT;

        boolean nested = hasNestedExpressions(expression);
        if (nested) {
            score += NESTING_WEIGHT;
        }

        if (hasConditionalLogic(expression)) {
            score += CONDITIONAL_WEIGHT;
        }

        boolean lookup = requiresDataLookup(expression, functionCalls);
        if (lookup) {
            score += LOOKUP_WEIGHT;
        }

        return new Complexity(score, score > threshold, nested, lookup);
    }

    /**
     * Maximum parenthesis depth greater than one.
     */
    static boolean hasNestedExpressions(String expression) {
        int depth = 0;
        int maxDepth = 0;

        for (char c : expression.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
            maxDepth = Math.max(maxDepth, depth);
        }

        return maxDepth > 1;
    }

    static boolean hasConditionalLogic(String expression) {
        return CONDITIONAL_TOKENS.stream().anyMatch(expression::contains);
    }

    static boolean requiresDataLookup(String expression, List<FunctionCall> functionCalls) {
        return functionCalls.stream().anyMatch(f -> LOOKUP_FUNCTIONS.contains(f.name().toLowerCase(Locale.ROOT)))
                || expression.contains("../")
                || expression.contains("[");
    }
}
