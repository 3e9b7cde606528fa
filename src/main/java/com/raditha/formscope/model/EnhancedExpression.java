package com.raditha.formscope.model;

import java.util.List;

/**
 * Analysis of a single rule or calculation expression.
 *
 * @param originalExpression  Raw expression text
 * @param parsedExpression    Trimmed expression text
 * @param type                Syntactic classification
 * @param referencedFields    Field paths in first-seen order, no duplicates
 * @param usedFunctions       Function names in call order
 * @param constants           String literals then numeric literals, no
 *                            duplicates
 * @param complex             Complexity score exceeded the threshold
 * @param hasNestedConditions Parentheses nest more than one level deep
 * @param requiresDataLookup  Uses user functions, parent paths or predicates
 * @param humanReadable       Plain-language paraphrase
 * @param returnType          Inferred value type
 * @param subExpressions      Decomposition, only populated when complex
 * @param translationHints    Hints for porting to the target platform
 */
public record EnhancedExpression(
        String originalExpression,
        String parsedExpression,
        ExpressionType type,
        List<String> referencedFields,
        List<String> usedFunctions,
        List<String> constants,
        boolean complex,
        boolean hasNestedConditions,
        boolean requiresDataLookup,
        String humanReadable,
        ValueType returnType,
        List<EnhancedExpression> subExpressions,
        List<String> translationHints) {

    public EnhancedExpression {
        referencedFields = List.copyOf(referencedFields);
        usedFunctions = List.copyOf(usedFunctions);
        constants = List.copyOf(constants);
        subExpressions = List.copyOf(subExpressions);
        translationHints = List.copyOf(translationHints);
    }

    /**
     * Count this expression and all nested sub-expressions.
     */
    public int totalNodeCount() {
        int count = 1;
        for (EnhancedExpression sub : subExpressions) {
            count += sub.totalNodeCount();
        }
        return count;
    }
}
