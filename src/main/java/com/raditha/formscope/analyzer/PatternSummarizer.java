package com.raditha.formscope.analyzer;

import com.raditha.formscope.extraction.ControlSequenceExtractor;
import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlSignature;

import java.util.ArrayList;
import java.util.List;

/**
 * Describes common shapes among mined groups.
 */
public class PatternSummarizer {

    public static final String TEXT_FIELD_TYPE = "TextField";
    public static final String DATE_PICKER_TYPE = "DatePicker";

    /**
     * @param groups Mined groups
     * @return One line per pattern with at least one match
     */
    public List<String> summarize(List<ControlGroup> groups) {
        List<String> patterns = new ArrayList<>();

        long textFieldGroups = groups.stream()
                .filter(g -> g.size() >= 2)
                .filter(g -> g.controls().stream().allMatch(c -> TEXT_FIELD_TYPE.equals(c.type())))
                .count();
        if (textFieldGroups > 0) {
            patterns.add(String.format("Found %d groups of sequential text fields", textFieldGroups));
        }

        long labelInputPairs = groups.stream()
                .filter(g -> g.size() == 2)
                .filter(g -> isLabel(g.controls().get(0)) && !isLabel(g.controls().get(1)))
                .count();
        if (labelInputPairs > 0) {
            patterns.add(String.format("Found %d label-input pairs", labelInputPairs));
        }

        long dateTimeGroups = groups.stream()
                .filter(g -> g.size() >= 2)
                .filter(g -> g.controls().stream().anyMatch(c -> DATE_PICKER_TYPE.equals(c.type())))
                .count();
        if (dateTimeGroups > 0) {
            patterns.add(String.format("Found %d date/time field combinations", dateTimeGroups));
        }

        return patterns;
    }

    private static boolean isLabel(ControlSignature control) {
        return ControlSequenceExtractor.LABEL_TYPE.equals(control.type());
    }
}
