package com.raditha.formscope.analysis;

import com.raditha.formscope.config.ExpressionAnalysisConfig;
import com.raditha.formscope.expression.ExpressionParser;
import com.raditha.formscope.expression.FunctionCall;
import com.raditha.formscope.expression.XPathFunctionParser;
import com.raditha.formscope.model.EnhancedExpression;
import com.raditha.formscope.model.ExpressionType;
import com.raditha.formscope.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Analyzes rule and calculation expressions.
 * <p>
 * Combines parser facts with constants, a complexity score, a plain-language
 * paraphrase, an inferred return type and, for complex expressions, a
 * decomposition into sub-expressions. Holds no mutable state; instances can
 * be shared between threads.
 */
public class ExpressionAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionAnalyzer.class);

    private final ExpressionParser parser;
    private final ExpressionAnalysisConfig config;
    private final ConstantExtractor constantExtractor;
    private final ComplexityScorer complexityScorer;
    private final HumanReadableRenderer renderer;
    private final ReturnTypeInferrer returnTypeInferrer;
    private final SubExpressionExtractor subExpressionExtractor;

    /**
     * Create analyzer with the XPath parser and default configuration.
     */
    public ExpressionAnalyzer() {
        this(new XPathFunctionParser(), ExpressionAnalysisConfig.defaults());
    }

    public ExpressionAnalyzer(ExpressionAnalysisConfig config) {
        this(new XPathFunctionParser(), config);
    }

    public ExpressionAnalyzer(ExpressionParser parser, ExpressionAnalysisConfig config) {
        this.parser = parser;
        this.config = config;
        this.constantExtractor = new ConstantExtractor();
        this.complexityScorer = new ComplexityScorer(config.complexityThreshold());
        this.renderer = new HumanReadableRenderer(config.fixOperatorOrdering());
        this.returnTypeInferrer = new ReturnTypeInferrer();
        this.subExpressionExtractor = new SubExpressionExtractor();
    }

    /**
     * Analyze an expression.
     *
     * @param expression Raw expression text
     * @return Analysis, or empty if the expression is null or empty
     */
    public Optional<EnhancedExpression> analyzeExpression(String expression) {
        if (expression == null || expression.isEmpty()) {
            return Optional.empty();
        }

        Node root = new Node(expression, 0);
        List<Node> visited = new ArrayList<>();
        Deque<Node> worklist = new ArrayDeque<>();
        worklist.add(root);

        while (!worklist.isEmpty()) {
            Node node = worklist.poll();
            visited.add(node);
            node.facts = analyzeSingle(node.text);

            if (!node.facts.complex()) {
                continue;
            }
            if (node.depth >= config.maxSubExpressionDepth()) {
                logger.debug("Sub-expression depth limit {} reached at '{}'", config.maxSubExpressionDepth(),
                        node.text);
                continue;
            }

            for (String candidate : subExpressionExtractor.extract(node.text)) {
                Node child = new Node(candidate, node.depth + 1);
                node.children.add(child);
                worklist.add(child);
            }
        }

        // Children are always visited after their parent
        for (int i = visited.size() - 1; i >= 0; i--) {
            visited.get(i).build();
        }

        return Optional.of(root.result);
    }

    /**
     * Simplify an expression using the parser.
     */
    public String simplifyExpression(String expression) {
        return parser.simplifyExpression(expression);
    }

    private Facts analyzeSingle(String expression) {
        ExpressionType type = parser.determineExpressionType(expression);
        List<String> fields = parser.extractFieldReferences(expression);
        List<FunctionCall> calls = parser.extractFunctionCalls(expression);
        List<String> functionNames = calls.stream().map(FunctionCall::name).toList();

        List<String> constants = constantExtractor.extract(expression);
        ComplexityScorer.Complexity complexity = complexityScorer.score(expression, fields, calls);
        String readable = renderer.render(expression, fields);
        ValueType returnType = returnTypeInferrer.infer(expression, calls);
        List<String> hints = parser.getTranslationHints(expression);

        return new Facts(expression, type, fields, functionNames, constants, complexity, readable, returnType,
                hints);
    }

    /**
     * Everything known about one expression except its sub-expressions.
     */
    private record Facts(
            String expression,
            ExpressionType type,
            List<String> fields,
            List<String> functions,
            List<String> constants,
            ComplexityScorer.Complexity complexity,
            String humanReadable,
            ValueType returnType,
            List<String> hints) {

        boolean complex() {
            return complexity.complex();
        }
    }

    private static final class Node {
        private final String text;
        private final int depth;
        private final List<Node> children = new ArrayList<>();
        private Facts facts;
        private EnhancedExpression result;

        Node(String text, int depth) {
            this.text = text;
            this.depth = depth;
        }

        void build() {
            List<EnhancedExpression> subExpressions = children.stream().map(c -> c.result).toList();
            result = new EnhancedExpression(
                    facts.expression(),
                    facts.expression().trim(),
                    facts.type(),
                    facts.fields(),
                    facts.functions(),
                    facts.constants(),
                    facts.complexity().complex(),
                    facts.complexity().nestedConditions(),
                    facts.complexity().requiresDataLookup(),
                    facts.humanReadable(),
                    facts.returnType(),
                    subExpressions,
                    facts.hints());
        }
    }
}
