package com.raditha.formscope.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HumanReadableRendererTest {

    private final HumanReadableRenderer renderer = new HumanReadableRenderer();

    @Test
    void testLongerFieldsReplacedFirst() {
        String readable = renderer.render("my:Amount + my:AmountTax", List.of("Amount", "AmountTax"));

        assertEquals("[Amount] + [AmountTax]", readable);
    }

    @Test
    void testPathFieldUsesLastSegment() {
        String readable = renderer.render("my:Order/my:Total > 100", List.of("Order/my:Total"));

        assertEquals("[Total] is greater than 100", readable);
    }

    @Test
    void testFunctionIdioms() {
        assertEquals("[Items] has more than 2 items",
                renderer.render("count(my:Items) > 2", List.of("Items")));
        assertEquals("[Items] has exactly 0 items",
                renderer.render("count(my:Items) = 0", List.of("Items")));
        assertEquals("sum of [Price]", renderer.render("sum(my:Price)", List.of("Price")));
        assertEquals("[Name] is empty", renderer.render("string-length(my:Name) = 0", List.of("Name")));
    }

    @Test
    void testNotEqualWording() {
        assertEquals("[Status] is not equal to \"Closed\"",
                renderer.render("my:Status != \"Closed\"", List.of("Status")));
    }

    @Test
    void testDisplayName() {
        assertEquals("Field", HumanReadableRenderer.displayName("Field"));
        assertEquals("Field", HumanReadableRenderer.displayName("Section/my:Field"));
        assertEquals("Field", HumanReadableRenderer.displayName("Section/Field"));
    }

    @Test
    void testFailureFallsBackToOriginal() {
        // A null field list cannot be sorted
        assertEquals("my:A = 1", renderer.render("my:A = 1", null));
    }
}
