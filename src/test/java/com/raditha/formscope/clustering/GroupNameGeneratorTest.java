package com.raditha.formscope.clustering;

import com.raditha.formscope.extraction.LabelNormalizer;
import com.raditha.formscope.model.ControlSignature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GroupNameGenerator.
 */
class GroupNameGeneratorTest {

    private final GroupNameGenerator generator = new GroupNameGenerator();

    private String name(String... labels) {
        List<ControlSignature> controls = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            controls.add(new ControlSignature(labels[i], "TextField", "c" + i, i, LabelNormalizer.normalize(labels[i])));
        }
        return generator.generateName(CandidateGroupMiner.generateGroupKey(controls), controls);
    }

    @Test
    void testKeywordFamilies() {
        assertEquals("NameFields", name("First Name", "Last Name"));
        assertEquals("AddressFields", name("Street Address", "City"));
        assertEquals("ContactFields", name("Email", "Phone"));
        assertEquals("OrganizationFields", name("Department", "Cost Center"));
        assertEquals("DateTimeFields", name("Start Date", "End Date"));
    }

    @Test
    void testFamilyPriority() {
        // Matches both the name and contact families
        assertEquals("NameFields", name("Contact Name", "Email"));
    }

    @Test
    void testAddressNeedsHalfOfItsKeywords() {
        assertEquals("StreetAddressToCountry", name("Street Address", "Country"));
    }

    @Test
    void testFallbackNames() {
        assertEquals("QuantityToAmount", name("Quantity", "Amount"));
        assertEquals("TotalCostGroup", name("Total Cost"));
        assertEquals("CommentsGroup", name("Comments"));
    }

    @Test
    void testUnlabelledGroup() {
        assertEquals("ControlGroup_TextFiel", name("", " "));
    }
}
