package com.raditha.formscope.similarity;

import com.raditha.formscope.model.ControlSignature;

import java.util.List;
import java.util.Objects;

/**
 * Scores how alike two control sequences are.
 * <p>
 * Sequences of different length score 0. Otherwise each position earns one
 * point when the types match and a second point when, additionally, the
 * labels are similar; the total is divided by twice the length.
 */
public class ControlGroupSimilarity {

    private final double labelThreshold;
    private final LevenshteinSimilarity levenshtein;

    /**
     * Create with default 70% label similarity threshold.
     */
    public ControlGroupSimilarity() {
        this(0.7);
    }

    /**
     * @param labelThreshold Minimum edit-distance similarity (0.0-1.0) for two
     *                       labels to count as similar
     */
    public ControlGroupSimilarity(double labelThreshold) {
        if (labelThreshold < 0.0 || labelThreshold > 1.0) {
            throw new IllegalArgumentException("Label threshold must be between 0.0 and 1.0");
        }
        this.labelThreshold = labelThreshold;
        this.levenshtein = new LevenshteinSimilarity();
    }

    /**
     * Calculate similarity between two control sequences.
     *
     * @return Score between 0.0 and 1.0
     */
    public double calculate(List<ControlSignature> group1, List<ControlSignature> group2) {
        if (group1.size() != group2.size() || group1.isEmpty()) {
            return 0.0;
        }

        int matches = 0;
        for (int i = 0; i < group1.size(); i++) {
            ControlSignature c1 = group1.get(i);
            ControlSignature c2 = group2.get(i);

            if (Objects.equals(c1.type(), c2.type())) {
                matches++;

                if (areLabelsSimilar(c1.normalizedLabel(), c2.normalizedLabel())) {
                    matches++;
                }
            }
        }

        return (double) matches / (group1.size() * 2);
    }

    /**
     * Labels are similar if equal ignoring case or close in edit distance.
     * Blank labels are never similar.
     */
    public boolean areLabelsSimilar(String label1, String label2) {
        if (label1 == null || label1.isEmpty() || label2 == null || label2.isEmpty()) {
            return false;
        }

        if (label1.equalsIgnoreCase(label2)) {
            return true;
        }

        return levenshtein.calculateIgnoreCase(label1, label2) >= labelThreshold;
    }
}
