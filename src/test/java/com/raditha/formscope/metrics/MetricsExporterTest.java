package com.raditha.formscope.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.formscope.model.AnalysisResult;
import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlKey;
import com.raditha.formscope.model.ControlSignature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricsExporter.
 */
class MetricsExporterTest {

    @TempDir
    Path tempDir;

    private MetricsExporter exporter;
    private AnalysisResult result;

    @BeforeEach
    void setUp() {
        exporter = new MetricsExporter();

        List<ControlSignature> controls = List.of(
                new ControlSignature("Email", "TextField", "txtEmail", 0, "EMAIL"),
                new ControlSignature("Phone", "TextField", "txtPhone", 1, "PHONE"));
        ControlGroup group = new ControlGroup("TextField_EMAIL|TextField_PHONE", controls,
                new LinkedHashSet<>(List.of("apply", "renew")), "ContactFields", true, false, null);

        Map<ControlKey, Integer> frequency = new LinkedHashMap<>();
        frequency.put(new ControlKey("TextField", "EMAIL"), 2);
        frequency.put(new ControlKey("TextField", "PHONE"), 2);

        result = new AnalysisResult(List.of(group), frequency, 2, 4, 1,
                List.of("Found 1 groups of sequential text fields"), List.of());
    }

    @Test
    void testBuildMetrics() {
        MetricsExporter.CorpusMetrics metrics = exporter.buildMetrics(result, "intake");

        assertEquals("intake", metrics.corpusName());
        assertEquals(1, metrics.totalGroups());
        assertEquals(2.0, metrics.averageGroupSize(), 0.001);
        assertEquals(2.0, metrics.averageOccurrences(), 0.001);
        assertEquals(List.of("Email", "Phone"), metrics.groups().get(0).labels());
        assertEquals("EMAIL", metrics.controlFrequency().get(0).normalizedLabel());
    }

    @Test
    void testBuildMetricsWithoutGroups() {
        AnalysisResult empty = new AnalysisResult(List.of(), Map.of(), 0, 0, 0, List.of(), List.of());

        MetricsExporter.CorpusMetrics metrics = exporter.buildMetrics(empty, "none");

        assertEquals(0, metrics.totalGroups());
        assertEquals(0.0, metrics.averageGroupSize(), 0.001);
    }

    @Test
    void testExportToCsv() throws IOException {
        Path csv = tempDir.resolve("metrics.csv");

        exporter.exportToCsv(exporter.buildMetrics(result, "intake, 2024"), csv);

        String content = Files.readString(csv);
        assertTrue(content.contains("# Corpus Summary"));
        assertTrue(content.contains(",\"intake, 2024\",2,4,1,1,2.00,2.00"), "Corpus name should be quoted");
        assertTrue(content.contains("# Groups\nname,controls,occurrences,labels,forms\n"));
        assertTrue(content.contains("ContactFields,2,2,Email;Phone,apply;renew"));
        assertTrue(content.contains("# Control Frequency\ntype,label,forms\nTextField,EMAIL,2\nTextField,PHONE,2\n"));
    }

    @Test
    void testExportToJson() throws IOException {
        Path json = tempDir.resolve("metrics.json");

        exporter.exportToJson(exporter.buildMetrics(result, "intake"), json);

        JsonNode root = new ObjectMapper().readTree(json.toFile());
        assertEquals("intake", root.get("corpusName").asText());
        assertEquals(2, root.get("totalForms").asInt());
        assertEquals("ContactFields", root.get("groups").get(0).get("name").asText());
        assertEquals("renew", root.get("groups").get(0).get("forms").get(1).asText());
        assertEquals(2, root.get("controlFrequency").size());
    }

    @Test
    void testEscape() {
        assertEquals("plain", MetricsExporter.escape("plain"));
        assertEquals("\"a,b\"", MetricsExporter.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", MetricsExporter.escape("say \"hi\""));
        assertEquals("", MetricsExporter.escape(null));
    }
}
