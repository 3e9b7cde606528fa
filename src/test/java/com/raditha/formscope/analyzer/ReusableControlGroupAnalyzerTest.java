package com.raditha.formscope.analyzer;

import com.raditha.formscope.config.MiningConfig;
import com.raditha.formscope.model.AnalysisResult;
import com.raditha.formscope.model.ControlDefinition;
import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlKey;
import com.raditha.formscope.model.FormDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReusableControlGroupAnalyzer.
 */
class ReusableControlGroupAnalyzerTest {

    private ReusableControlGroupAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ReusableControlGroupAnalyzer();
    }

    private static ControlDefinition text(String label) {
        return ControlDefinition.of(label.replace(" ", ""), "TextField", label);
    }

    private static ControlDefinition date(String label) {
        return ControlDefinition.of(label.replace(" ", ""), "DatePicker", label);
    }

    private static FormDefinition form(String name, ControlDefinition... controls) {
        return FormDefinition.singleView(name, List.of(controls));
    }

    private static Map<String, FormDefinition> corpus() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        forms.put("f1", form("Form 1", text("Email"), text("Phone")));
        forms.put("f2", form("Form 2", text("Email"), text("Phone")));
        forms.put("f3", form("Form 3", text("Email"), text("Phone")));
        forms.put("f4", form("Form 4", date("Start Date"), date("End Date"), text("Reason")));
        forms.put("f5", form("Form 5", date("Start Date"), date("End Date"), text("Reason")));
        return forms;
    }

    @Test
    void testSharedSequenceFoundInBothForms() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        forms.put("onboarding", form("Onboarding", text("First Name"), text("Last Name"), date("Start Date")));
        forms.put("transfer", form("Transfer", text("First Name"), text("Last Name"), date("Start Date")));

        AnalysisResult result = analyzer.analyzeForReusableGroups(forms, 2, 3, 10);

        assertEquals(1, result.identifiedGroups().size());
        ControlGroup group = result.identifiedGroups().get(0);
        assertEquals(2, group.occurrenceCount());
        assertEquals(3, group.size());
        assertEquals(Set.of("onboarding", "transfer"), group.foundInForms());
        assertEquals("NameFields", group.suggestedName());
        assertTrue(group.sequential());
        assertFalse(group.containsRepeatingControls());
        assertNull(group.commonSection());
    }

    @Test
    void testLargestGroupRanksFirstAmongEquals() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        forms.put("onboarding", form("Onboarding", text("First Name"), text("Last Name"), date("Start Date")));
        forms.put("transfer", form("Transfer", text("First Name"), text("Last Name"), date("Start Date")));

        AnalysisResult result = analyzer.analyzeForReusableGroups(forms);

        assertEquals(3, result.identifiedGroups().size(), "Both sub-windows recur as well");
        assertEquals(3, result.identifiedGroups().get(0).size());
    }

    @Test
    void testRankingByOccurrenceThenSize() {
        AnalysisResult result = analyzer.analyzeForReusableGroups(corpus());

        assertEquals(List.of(
                "TextField_EMAIL|TextField_PHONE",
                "DatePicker_STARTDATE|DatePicker_ENDDATE|TextField_REASON",
                "DatePicker_STARTDATE|DatePicker_ENDDATE",
                "DatePicker_ENDDATE|TextField_REASON"),
                result.identifiedGroups().stream().map(ControlGroup::groupId).toList());
        assertEquals(3, result.identifiedGroups().get(0).occurrenceCount());
        assertEquals("ContactFields", result.identifiedGroups().get(0).suggestedName());
    }

    @Test
    void testTotalsAndPatterns() {
        AnalysisResult result = analyzer.analyzeForReusableGroups(corpus());

        assertEquals(5, result.totalFormsAnalyzed());
        assertEquals(12, result.totalControlsAnalyzed());
        assertEquals(0, result.controlsInRepeatingSections());
        assertEquals(List.of(
                "Found 1 groups of sequential text fields",
                "Found 3 date/time field combinations"), result.commonPatterns());
    }

    @Test
    void testOccurrenceBoundary() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        forms.put("a", form("A", text("Email"), text("Phone")));
        forms.put("b", form("B", text("Email"), text("Phone")));
        forms.put("c", form("C", text("Fax"), text("Website")));

        assertFalse(analyzer.analyzeForReusableGroups(forms, 3, 2, 10).hasGroups(),
                "Two forms do not meet a minimum of three");
        assertTrue(analyzer.analyzeForReusableGroups(forms, 2, 2, 10).hasGroups());
    }

    @Test
    void testNearDuplicatesAreMerged() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        forms.put("f1", form("F1", text("Address"), text("City")));
        forms.put("f2", form("F2", text("Addres"), text("City")));

        AnalysisResult result = analyzer.analyzeForReusableGroups(forms, 1, 2, 10);

        assertEquals(1, result.identifiedGroups().size());
        ControlGroup group = result.identifiedGroups().get(0);
        assertEquals("TextField_ADDRESS|TextField_CITY", group.groupId());
        assertEquals(Set.of("f1", "f2"), group.foundInForms());
        assertEquals("AddressFields", group.suggestedName());
    }

    @Test
    void testRepeatingControlsAreExcluded() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        for (String id : List.of("f1", "f2", "f3")) {
            forms.put(id, form(id,
                    text("Requester"),
                    ControlDefinition.repeating("item", "TextField", "Item", "Lines"),
                    ControlDefinition.repeating("qty", "TextField", "Quantity", "Lines"),
                    text("Approver")));
        }

        AnalysisResult result = analyzer.analyzeForReusableGroups(forms);

        assertEquals(1, result.identifiedGroups().size());
        assertEquals("TextField_REQUESTER|TextField_APPROVER", result.identifiedGroups().get(0).groupId());
        assertEquals(6, result.totalControlsAnalyzed());
        assertEquals(6, result.controlsInRepeatingSections());
        assertEquals(3, result.repeatingSections().size(), "One Lines section per form");
    }

    @Test
    void testFrequencyCountsEachFormOnce() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>();
        forms.put("f1", form("F1", text("Email"), text("Email"), text("First Name")));
        forms.put("f2", form("F2", text("First Name")));

        Map<ControlKey, Integer> frequency = analyzer.analyzeForReusableGroups(forms).controlFrequency();

        assertEquals(List.of(new ControlKey("TextField", "FIRSTNAME"), new ControlKey("TextField", "EMAIL")),
                new ArrayList<>(frequency.keySet()));
        assertEquals(2, frequency.get(new ControlKey("TextField", "FIRSTNAME")));
        assertEquals(1, frequency.get(new ControlKey("TextField", "EMAIL")));
    }

    @Test
    void testResultIndependentOfInputOrder() {
        Map<String, FormDefinition> ordered = corpus();
        Map<String, FormDefinition> reversed = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>(ordered.keySet());
        for (int i = ids.size() - 1; i >= 0; i--) {
            reversed.put(ids.get(i), ordered.get(ids.get(i)));
        }

        AnalysisResult first = analyzer.analyzeForReusableGroups(ordered);
        AnalysisResult second = analyzer.analyzeForReusableGroups(new HashMap<>(reversed));

        assertEquals(first.identifiedGroups(), second.identifiedGroups());
        assertEquals(new ArrayList<>(first.controlFrequency().entrySet()),
                new ArrayList<>(second.controlFrequency().entrySet()));
    }

    @Test
    void testEmptyCorpus() {
        AnalysisResult result = analyzer.analyzeForReusableGroups(Map.of());

        assertFalse(result.hasGroups());
        assertEquals(0, result.totalFormsAnalyzed());
        assertTrue(result.commonPatterns().isEmpty());
    }

    @Test
    void testMinimumSizeAboveMaximumFindsNothing() {
        AnalysisResult result = analyzer.analyzeForReusableGroups(corpus(), 2, 5, 3);

        assertFalse(result.hasGroups(), "No window sizes to scan");
        assertTrue(result.commonPatterns().isEmpty());
        assertEquals(5, result.totalFormsAnalyzed(), "Corpus statistics are still reported");
        assertEquals(12, result.totalControlsAnalyzed());
        assertFalse(result.controlFrequency().isEmpty());
    }

    @Test
    void testNonPositiveBoundsCountAsOne() {
        Map<String, FormDefinition> forms = new LinkedHashMap<>(corpus());
        forms.put("f6", form("Form 6", text("Notes"), text("Comments")));

        AnalysisResult zero = analyzer.analyzeForReusableGroups(forms, 0, 2, 10);

        assertEquals(analyzer.analyzeForReusableGroups(forms, 1, 2, 10).identifiedGroups(),
                zero.identifiedGroups());
        assertTrue(zero.identifiedGroups().stream().anyMatch(g -> g.foundInForms().equals(Set.of("f6"))),
                "Groups found in a single form are kept");

        assertEquals(analyzer.analyzeForReusableGroups(forms, 2, 1, 2).identifiedGroups(),
                analyzer.analyzeForReusableGroups(forms, 2, -3, 2).identifiedGroups());
    }

    @Test
    void testStrictPreset() {
        ReusableControlGroupAnalyzer strict = new ReusableControlGroupAnalyzer(MiningConfig.strict());

        AnalysisResult result = strict.analyzeForReusableGroups(corpus());

        assertTrue(result.identifiedGroups().isEmpty(), "No size-3 group occurs in three forms");
    }
}
