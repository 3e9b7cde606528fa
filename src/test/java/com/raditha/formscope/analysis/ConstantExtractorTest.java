package com.raditha.formscope.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstantExtractorTest {

    private final ConstantExtractor extractor = new ConstantExtractor();

    @Test
    void testStringsThenNumbers() {
        List<String> constants = extractor.extract("concat(\"Hello\", ' ', my:Name, 42, 3.5, \"Hello\")");

        assertEquals(List.of("Hello", " ", "42", "3.5"), constants);
    }

    @Test
    void testDigitsInsideNamesAreNotNumbers() {
        assertEquals(List.of(), extractor.extract("my:Field1 = my:Field2"));
    }
}
