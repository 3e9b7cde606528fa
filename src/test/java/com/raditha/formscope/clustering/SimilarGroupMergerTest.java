package com.raditha.formscope.clustering;

import com.raditha.formscope.extraction.LabelNormalizer;
import com.raditha.formscope.model.ControlSignature;
import com.raditha.formscope.similarity.ControlGroupSimilarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarGroupMergerTest {

    private SimilarGroupMerger merger;

    @BeforeEach
    void setUp() {
        merger = new SimilarGroupMerger();
    }

    private static CandidateGroup group(String first, String second, String... forms) {
        List<ControlSignature> controls = List.of(
                new ControlSignature(first, "TextField", first, 0, LabelNormalizer.normalize(first)),
                new ControlSignature(second, "TextField", second, 1, LabelNormalizer.normalize(second)));
        CandidateGroup group = new CandidateGroup(CandidateGroupMiner.generateGroupKey(controls), controls);
        for (String form : forms) {
            group.addForm(form);
        }
        return group;
    }

    @Test
    void testMoreFrequentGroupAbsorbsSimilarOne() {
        CandidateGroup typo = group("Addres", "City", "f3");
        CandidateGroup common = group("Address", "City", "f1", "f2");

        List<CandidateGroup> merged = merger.merge(List.of(typo, common));

        assertEquals(1, merged.size());
        assertSame(common, merged.get(0));
        assertEquals(Set.of("f1", "f2", "f3"), merged.get(0).forms());
    }

    @Test
    void testDissimilarGroupsSurvive() {
        CandidateGroup contact = group("Email", "Phone", "f1", "f2");
        CandidateGroup address = group("Address", "City", "f1", "f2");

        List<CandidateGroup> merged = merger.merge(List.of(contact, address));

        assertEquals(2, merged.size());
        assertEquals(Set.of("f1", "f2"), merged.get(0).forms());
    }

    @Test
    void testTiesKeepFirstSeenOrder() {
        CandidateGroup first = group("Email", "Phone", "f1", "f2");
        CandidateGroup second = group("Address", "City", "f3", "f4");

        List<CandidateGroup> merged = merger.merge(List.of(first, second));

        assertSame(first, merged.get(0));
        assertSame(second, merged.get(1));
    }

    @Test
    void testThresholdIsConfigurable() {
        SimilarGroupMerger loose = new SimilarGroupMerger(0.5, new ControlGroupSimilarity());
        CandidateGroup contact = group("Email", "Phone", "f1", "f2");
        CandidateGroup address = group("Address", "City", "f3");

        // Types match at every position: 2 of 4 points
        List<CandidateGroup> merged = loose.merge(List.of(contact, address));

        assertEquals(1, merged.size());
        assertEquals(Set.of("f1", "f2", "f3"), merged.get(0).forms());
    }
}
