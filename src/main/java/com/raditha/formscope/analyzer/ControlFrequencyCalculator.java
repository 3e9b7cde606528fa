package com.raditha.formscope.analyzer;

import com.raditha.formscope.model.ControlKey;
import com.raditha.formscope.model.ControlSignature;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts how many forms contain each control signature.
 */
public class ControlFrequencyCalculator {

    /**
     * @param sequences Control sequence of each form
     * @return Form count per signature, highest first; ties keep first-seen
     *         order
     */
    public Map<ControlKey, Integer> calculate(Collection<List<ControlSignature>> sequences) {
        Map<ControlKey, Integer> counts = new LinkedHashMap<>();

        for (List<ControlSignature> sequence : sequences) {
            Set<ControlKey> distinct = new LinkedHashSet<>();
            sequence.forEach(c -> distinct.add(c.key()));
            distinct.forEach(key -> counts.merge(key, 1, Integer::sum));
        }

        Map<ControlKey, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<ControlKey, Integer>comparingByValue().reversed())
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }
}
