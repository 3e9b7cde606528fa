package com.raditha.formscope.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.formscope.model.AnalysisResult;
import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlSignature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports mining metrics to CSV and JSON formats for dashboards and
 * migration planning.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Corpus-level metrics.
     */
    public record CorpusMetrics(
            String corpusName,
            String timestamp,
            int totalForms,
            int totalControls,
            int controlsInRepeatingSections,
            int totalGroups,
            double averageGroupSize,
            double averageOccurrences,
            List<String> patterns,
            List<GroupMetrics> groups,
            List<ControlFrequency> controlFrequency) {
    }

    /**
     * Per-group metrics.
     */
    public record GroupMetrics(
            String name,
            String groupId,
            int controlCount,
            int occurrences,
            List<String> labels,
            List<String> forms) {
    }

    /**
     * Number of forms containing a control signature.
     */
    public record ControlFrequency(String type, String normalizedLabel, int forms) {
    }

    /**
     * Build metrics from a mining result.
     */
    public CorpusMetrics buildMetrics(AnalysisResult result, String corpusName) {
        List<GroupMetrics> groups = result.identifiedGroups().stream()
                .map(this::buildGroupMetrics)
                .toList();

        double avgSize = result.identifiedGroups().stream()
                .mapToInt(ControlGroup::size)
                .average()
                .orElse(0.0);

        double avgOccurrences = result.identifiedGroups().stream()
                .mapToInt(ControlGroup::occurrenceCount)
                .average()
                .orElse(0.0);

        List<ControlFrequency> frequency = result.controlFrequency().entrySet().stream()
                .map(e -> new ControlFrequency(e.getKey().type(), e.getKey().normalizedLabel(), e.getValue()))
                .toList();

        return new CorpusMetrics(
                corpusName,
                LocalDateTime.now().format(TIMESTAMP_FORMAT),
                result.totalFormsAnalyzed(),
                result.totalControlsAnalyzed(),
                result.controlsInRepeatingSections(),
                groups.size(),
                avgSize,
                avgOccurrences,
                result.commonPatterns(),
                groups,
                frequency);
    }

    private GroupMetrics buildGroupMetrics(ControlGroup group) {
        return new GroupMetrics(
                group.suggestedName(),
                group.groupId(),
                group.size(),
                group.occurrenceCount(),
                group.controls().stream().map(ControlSignature::label).toList(),
                List.copyOf(group.foundInForms()));
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(CorpusMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Corpus Summary\n");
        csv.append("timestamp,corpus,total_forms,total_controls,repeating_controls,total_groups,avg_group_size,"
                + "avg_occurrences\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d,%.2f,%.2f\n",
                metrics.timestamp(),
                escape(metrics.corpusName()),
                metrics.totalForms(),
                metrics.totalControls(),
                metrics.controlsInRepeatingSections(),
                metrics.totalGroups(),
                metrics.averageGroupSize(),
                metrics.averageOccurrences()));

        csv.append("\n");

        csv.append("# Groups\n");
        csv.append("name,controls,occurrences,labels,forms\n");
        for (GroupMetrics group : metrics.groups()) {
            csv.append(String.format("%s,%d,%d,%s,%s\n",
                    escape(group.name()),
                    group.controlCount(),
                    group.occurrences(),
                    escape(String.join(";", group.labels())),
                    escape(String.join(";", group.forms()))));
        }

        csv.append("\n");

        csv.append("# Control Frequency\n");
        csv.append("type,label,forms\n");
        for (ControlFrequency control : metrics.controlFrequency()) {
            csv.append(String.format("%s,%s,%d\n",
                    escape(control.type()),
                    escape(control.normalizedLabel()),
                    control.forms()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(CorpusMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Quote a CSV value if it contains a separator, quote or line break.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
