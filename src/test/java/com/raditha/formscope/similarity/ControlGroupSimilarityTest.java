package com.raditha.formscope.similarity;

import com.raditha.formscope.extraction.LabelNormalizer;
import com.raditha.formscope.model.ControlSignature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlGroupSimilarityTest {

    private final ControlGroupSimilarity similarity = new ControlGroupSimilarity();

    private static ControlSignature control(String type, String label, int position) {
        return new ControlSignature(label, type, label, position, LabelNormalizer.normalize(label));
    }

    @Test
    void testIdenticalGroups() {
        List<ControlSignature> group = List.of(control("TextField", "Address", 0), control("TextField", "City", 1));

        assertEquals(1.0, similarity.calculate(group, group), 0.001);
    }

    @Test
    void testSimilarLabels() {
        List<ControlSignature> g1 = List.of(control("TextField", "Address", 0), control("TextField", "City", 1));
        List<ControlSignature> g2 = List.of(control("TextField", "Addres", 3), control("TextField", "City", 4));

        assertEquals(1.0, similarity.calculate(g1, g2), 0.001);
    }

    @Test
    void testTypesMatchLabelsDiffer() {
        List<ControlSignature> g1 = List.of(control("TextField", "Email", 0));
        List<ControlSignature> g2 = List.of(control("TextField", "Phone", 0));

        assertEquals(0.5, similarity.calculate(g1, g2), 0.001);
    }

    @Test
    void testLabelsIgnoredWhenTypesDiffer() {
        List<ControlSignature> g1 = List.of(control("TextField", "Start Date", 0));
        List<ControlSignature> g2 = List.of(control("DatePicker", "Start Date", 0));

        assertEquals(0.0, similarity.calculate(g1, g2), 0.001);
    }

    @Test
    void testDifferentLengthsScoreZero() {
        List<ControlSignature> g1 = List.of(control("TextField", "A", 0));
        List<ControlSignature> g2 = List.of(control("TextField", "A", 0), control("TextField", "B", 1));

        assertEquals(0.0, similarity.calculate(g1, g2), 0.001);
    }

    @Test
    void testLabelSimilarity() {
        assertTrue(similarity.areLabelsSimilar("ADDRESS", "ADDRES"));
        assertTrue(similarity.areLabelsSimilar("City", "CITY"));
        assertFalse(similarity.areLabelsSimilar("EMAIL", "PHONE"));
        assertFalse(similarity.areLabelsSimilar("", ""), "Blank labels are never similar");
    }

    @Test
    void testInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new ControlGroupSimilarity(1.5));
    }
}
