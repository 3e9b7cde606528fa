package com.raditha.formscope.analyzer;

import com.raditha.formscope.config.MiningConfig;
import com.raditha.formscope.model.AnalysisResult;
import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlKey;
import com.raditha.formscope.model.ControlSignature;
import com.raditha.formscope.model.RepeatingSectionInfo;

import java.util.Map;

/**
 * Text report of a mining run.
 */
public record ReusableGroupReport(AnalysisResult result, MiningConfig config) {

    private static final int TOP_CONTROLS = 10;

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d reusable groups in %d forms (%d controls analyzed, %d in repeating sections, min occurrences: %d)",
                result.identifiedGroups().size(),
                result.totalFormsAnalyzed(),
                result.totalControlsAnalyzed(),
                result.controlsInRepeatingSections(),
                config.minOccurrences());
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("REUSABLE CONTROL GROUP REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Group size: ").append(config.minGroupSize()).append("-").append(config.maxGroupSize())
                .append("\n");
        sb.append("Merge threshold: ")
                .append(String.format("%.0f%%", config.groupSimilarityThreshold() * 100)).append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (!result.hasGroups()) {
            sb.append("No reusable groups found.\n");
        } else {
            sb.append("Groups (by occurrence):\n");
            sb.append("-".repeat(80)).append("\n\n");

            int index = 1;
            for (ControlGroup group : result.identifiedGroups()) {
                sb.append(String.format("Group #%d - %s\n", index++, group.formatSummary()));
                for (ControlSignature control : group.controls()) {
                    sb.append(String.format("  %-15s %s\n", control.type(), control.label()));
                }
                sb.append("  Forms: ").append(String.join(", ", group.foundInForms())).append("\n\n");
            }
        }

        if (!result.commonPatterns().isEmpty()) {
            sb.append("Patterns:\n");
            result.commonPatterns().forEach(p -> sb.append("  ").append(p).append("\n"));
            sb.append("\n");
        }

        if (!result.controlFrequency().isEmpty()) {
            sb.append("Most common controls:\n");
            result.controlFrequency().entrySet().stream()
                    .limit(TOP_CONTROLS)
                    .forEach(e -> appendFrequency(sb, e));
            sb.append("\n");
        }

        if (!result.repeatingSections().isEmpty()) {
            sb.append("Repeating sections (excluded from mining):\n");
            for (RepeatingSectionInfo section : result.repeatingSections()) {
                sb.append(String.format("  %s [%s]: %d controls %s\n",
                        section.name(), section.formName(), section.controlCount(), section.controlTypes()));
            }
        }

        return sb.toString();
    }

    private static void appendFrequency(StringBuilder sb, Map.Entry<ControlKey, Integer> entry) {
        sb.append(String.format("  %-40s %d forms\n", entry.getKey(), entry.getValue()));
    }
}
