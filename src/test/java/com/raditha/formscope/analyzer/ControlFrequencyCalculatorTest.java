package com.raditha.formscope.analyzer;

import com.raditha.formscope.model.ControlKey;
import com.raditha.formscope.model.ControlSignature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControlFrequencyCalculatorTest {

    private static ControlSignature control(String type, String normalized) {
        return new ControlSignature(normalized, type, normalized, 0, normalized);
    }

    @Test
    void testTiesKeepFirstSeenOrder() {
        Map<ControlKey, Integer> frequency = new ControlFrequencyCalculator().calculate(List.of(
                List.of(control("TextField", "A"), control("TextField", "B")),
                List.of(control("TextField", "C"), control("TextField", "B"))));

        assertEquals(List.of(
                new ControlKey("TextField", "B"),
                new ControlKey("TextField", "A"),
                new ControlKey("TextField", "C")), new ArrayList<>(frequency.keySet()));
    }

    @Test
    void testTypeIsPartOfTheKey() {
        Map<ControlKey, Integer> frequency = new ControlFrequencyCalculator().calculate(List.of(
                List.of(control("TextField", "DATE"), control("DatePicker", "DATE"))));

        assertEquals(2, frequency.size());
    }
}
