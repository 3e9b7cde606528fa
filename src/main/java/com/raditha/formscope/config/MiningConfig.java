package com.raditha.formscope.config;

/**
 * Configuration for reusable control group mining.
 *
 * @param minOccurrences           Minimum number of distinct forms a group
 *                                 must appear in
 * @param minGroupSize             Smallest window of controls to consider
 * @param maxGroupSize             Largest window of controls to consider
 * @param groupSimilarityThreshold Minimum similarity (0.0-1.0) for two
 *                                 groups to be merged
 * @param labelSimilarityThreshold Minimum edit-distance similarity (0.0-1.0)
 *                                 for two labels to count as similar
 */
public record MiningConfig(
        int minOccurrences,
        int minGroupSize,
        int maxGroupSize,
        double groupSimilarityThreshold,
        double labelSimilarityThreshold) {

    /**
     * Validate configuration.
     */
    public MiningConfig {
        if (minOccurrences < 1) {
            throw new IllegalArgumentException("minOccurrences must be >= 1");
        }
        if (minGroupSize < 1) {
            throw new IllegalArgumentException("minGroupSize must be >= 1");
        }
        if (maxGroupSize < minGroupSize) {
            throw new IllegalArgumentException(
                    String.format("maxGroupSize (%d) must be >= minGroupSize (%d)", maxGroupSize, minGroupSize));
        }
        if (groupSimilarityThreshold < 0.0 || groupSimilarityThreshold > 1.0) {
            throw new IllegalArgumentException("groupSimilarityThreshold must be between 0.0 and 1.0");
        }
        if (labelSimilarityThreshold < 0.0 || labelSimilarityThreshold > 1.0) {
            throw new IllegalArgumentException("labelSimilarityThreshold must be between 0.0 and 1.0");
        }
    }

    /**
     * Default preset: groups of 2-10 controls found in at least 2 forms,
     * merged at 80% similarity.
     */
    public static MiningConfig defaults() {
        return new MiningConfig(
                2, // minOccurrences
                2, // minGroupSize
                10, // maxGroupSize
                0.8, // groupSimilarityThreshold
                0.7); // labelSimilarityThreshold
    }

    /**
     * Strict preset: larger groups found in at least 3 forms, merged only when
     * nearly identical.
     */
    public static MiningConfig strict() {
        return new MiningConfig(
                3, // minOccurrences
                3, // minGroupSize
                10, // maxGroupSize
                0.9, // groupSimilarityThreshold - near-identical groups only
                0.85); // labelSimilarityThreshold
    }

    /**
     * Lenient preset: more tolerant to label variations.
     */
    public static MiningConfig lenient() {
        return new MiningConfig(
                2, // minOccurrences
                2, // minGroupSize
                12, // maxGroupSize - longer sections in lenient mode
                0.7, // groupSimilarityThreshold
                0.6); // labelSimilarityThreshold - tolerates typos and abbreviations
    }
}
