package com.raditha.formscope.analysis;

import com.raditha.formscope.expression.ExpressionParser;
import com.raditha.formscope.expression.FunctionCall;
import com.raditha.formscope.model.EnhancedExpression;
import com.raditha.formscope.model.ExpressionType;
import com.raditha.formscope.model.FormRule;
import com.raditha.formscope.model.FormRuleAction;
import com.raditha.formscope.model.RuleAnalysisResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregates expression analysis over the rules of one or more forms.
 */
public class RuleAnalyzer {

    private final ExpressionAnalyzer analyzer;
    private final ExpressionParser parser;

    public RuleAnalyzer(ExpressionAnalyzer analyzer, ExpressionParser parser) {
        this.analyzer = analyzer;
        this.parser = parser;
    }

    /**
     * Analyze the condition and action expressions of each rule.
     *
     * @param rules Rules to analyze
     * @return Aggregated counts and the analyzed expressions
     */
    public RuleAnalysisResult analyze(List<FormRule> rules) {
        int simple = 0;
        int complex = 0;
        int calculations = 0;
        Set<String> usedFunctions = new LinkedHashSet<>();
        Set<String> customFunctions = new LinkedHashSet<>();
        Map<ExpressionType, Integer> types = new EnumMap<>(ExpressionType.class);
        List<EnhancedExpression> expressions = new ArrayList<>();

        for (FormRule rule : rules) {
            Optional<EnhancedExpression> condition = rule.hasCondition()
                    ? analyzer.analyzeExpression(rule.condition())
                    : Optional.empty();
            if (condition.map(EnhancedExpression::complex).orElse(false)) {
                complex++;
            } else {
                simple++;
            }

            List<EnhancedExpression> ruleExpressions = new ArrayList<>();
            condition.ifPresent(ruleExpressions::add);
            rule.actions().stream()
                    .map(FormRuleAction::expression)
                    .map(analyzer::analyzeExpression)
                    .flatMap(Optional::stream)
                    .forEach(ruleExpressions::add);

            boolean calculation = false;
            for (EnhancedExpression expression : ruleExpressions) {
                expressions.add(expression);
                types.merge(expression.type(), 1, Integer::sum);
                usedFunctions.addAll(expression.usedFunctions());
                if (expression.type() == ExpressionType.CALCULATION
                        || expression.type() == ExpressionType.AGGREGATION) {
                    calculation = true;
                }

                parser.extractFunctionCalls(expression.originalExpression()).stream()
                        .filter(call -> !call.knownFunction())
                        .map(FunctionCall::name)
                        .forEach(customFunctions::add);
            }

            if (calculation) {
                calculations++;
            }
        }

        return new RuleAnalysisResult(
                rules.size(),
                simple,
                complex,
                calculations,
                new ArrayList<>(usedFunctions),
                new ArrayList<>(customFunctions),
                types,
                expressions);
    }
}
