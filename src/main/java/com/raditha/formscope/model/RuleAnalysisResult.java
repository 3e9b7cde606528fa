package com.raditha.formscope.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated analysis of a set of form rules.
 *
 * @param totalRules              Number of rules analyzed
 * @param simpleRules             Rules whose condition is not complex
 * @param complexRules            Rules whose condition is complex
 * @param calculationRules        Rules with a calculation or aggregation
 *                                expression
 * @param usedFunctions           Distinct functions in first-seen order
 * @param customFunctions         Distinct functions unknown to the catalog
 * @param expressionTypes         Number of analyzed expressions per type
 * @param expressions             Every analyzed condition and action
 *                                expression
 */
public record RuleAnalysisResult(
        int totalRules,
        int simpleRules,
        int complexRules,
        int calculationRules,
        List<String> usedFunctions,
        List<String> customFunctions,
        Map<ExpressionType, Integer> expressionTypes,
        List<EnhancedExpression> expressions) {

    public RuleAnalysisResult {
        usedFunctions = List.copyOf(usedFunctions);
        customFunctions = List.copyOf(customFunctions);
        expressionTypes = expressionTypes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(expressionTypes));
        expressions = List.copyOf(expressions);
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format("%d rules (%d simple, %d complex, %d calculations), %d functions used, %d custom",
                totalRules, simpleRules, complexRules, calculationRules,
                usedFunctions.size(), customFunctions.size());
    }
}
