package com.raditha.formscope.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of mining a form corpus for reusable control groups.
 *
 * @param identifiedGroups            Ranked and named groups
 * @param controlFrequency            Number of forms containing each control
 *                                    signature, highest first
 * @param totalFormsAnalyzed          Forms in the corpus
 * @param totalControlsAnalyzed       Controls that made it into sequences
 * @param controlsInRepeatingSections Controls excluded as repeating
 * @param commonPatterns              Descriptive pattern summaries
 * @param repeatingSections           Repeating section inventory
 */
public record AnalysisResult(
        List<ControlGroup> identifiedGroups,
        Map<ControlKey, Integer> controlFrequency,
        int totalFormsAnalyzed,
        int totalControlsAnalyzed,
        int controlsInRepeatingSections,
        List<String> commonPatterns,
        List<RepeatingSectionInfo> repeatingSections) {

    public AnalysisResult {
        identifiedGroups = List.copyOf(identifiedGroups);
        controlFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(controlFrequency));
        commonPatterns = List.copyOf(commonPatterns);
        repeatingSections = List.copyOf(repeatingSections);
    }

    /**
     * Check if any reusable groups were found.
     */
    public boolean hasGroups() {
        return !identifiedGroups.isEmpty();
    }
}
