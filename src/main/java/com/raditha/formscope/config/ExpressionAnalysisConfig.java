package com.raditha.formscope.config;

/**
 * Configuration for expression analysis.
 *
 * @param complexityThreshold   An expression is complex when its score is
 *                              strictly greater than this value
 * @param maxSubExpressionDepth Maximum decomposition depth; complex
 *                              expressions at this depth are not decomposed
 *                              further
 * @param fixOperatorOrdering   If true, {@code >=} and {@code <=} are worded
 *                              before {@code =}, {@code >} and {@code <};
 *                              if false the legacy order is kept and compound
 *                              operators come out as "is greater than equals"
 */
public record ExpressionAnalysisConfig(
        int complexityThreshold,
        int maxSubExpressionDepth,
        boolean fixOperatorOrdering) {

    public static final int DEFAULT_COMPLEXITY_THRESHOLD = 5;
    public static final int DEFAULT_MAX_SUB_EXPRESSION_DEPTH = 16;

    /**
     * Validate configuration.
     */
    public ExpressionAnalysisConfig {
        if (complexityThreshold < 0) {
            throw new IllegalArgumentException("complexityThreshold must be >= 0");
        }
        if (maxSubExpressionDepth < 0) {
            throw new IllegalArgumentException("maxSubExpressionDepth must be >= 0");
        }
    }

    /**
     * Default configuration: threshold 5, depth 16, legacy operator wording.
     */
    public static ExpressionAnalysisConfig defaults() {
        return new ExpressionAnalysisConfig(
                DEFAULT_COMPLEXITY_THRESHOLD,
                DEFAULT_MAX_SUB_EXPRESSION_DEPTH,
                false);
    }

    public ExpressionAnalysisConfig withFixedOperatorOrdering() {
        return new ExpressionAnalysisConfig(complexityThreshold, maxSubExpressionDepth, true);
    }
}
