package com.raditha.formscope.extraction;

import com.raditha.formscope.model.ControlDefinition;
import com.raditha.formscope.model.FormDefinition;
import com.raditha.formscope.model.RepeatingSectionInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lists the repeating tables and repeating sections of a form.
 * Purely descriptive; does not influence mining.
 */
public class RepeatingSectionInventory {

    public static final String REPEATING_TABLE_TYPE = "RepeatingTable";

    /**
     * Describe the repeating content of a form.
     *
     * @param formId Identifier of the form
     * @param form   Form definition
     * @return Repeating tables first, then named repeating sections
     */
    public List<RepeatingSectionInfo> describe(String formId, FormDefinition form) {
        List<RepeatingSectionInfo> sections = new ArrayList<>();
        Map<String, SectionTally> named = new LinkedHashMap<>();

        form.allControls().forEach(control -> {
            if (REPEATING_TABLE_TYPE.equals(control.type())) {
                List<String> childTypes = control.controls().stream()
                        .map(ControlDefinition::type)
                        .filter(Objects::nonNull)
                        .distinct()
                        .toList();
                sections.add(new RepeatingSectionInfo(
                        control.displayLabel(),
                        formId,
                        control.controls().size(),
                        childTypes));
            }

            String sectionName = control.repeatingSectionName();
            if (control.inRepeatingSection() && sectionName != null && !sectionName.isEmpty()) {
                named.computeIfAbsent(sectionName, k -> new SectionTally()).add(control.type());
            }
        });

        named.forEach((name, tally) -> sections.add(
                new RepeatingSectionInfo(name, formId, tally.count, new ArrayList<>(tally.types))));

        return sections;
    }

    private static final class SectionTally {
        private int count;
        private final Set<String> types = new LinkedHashSet<>();

        void add(String type) {
            count++;
            if (type != null) {
                types.add(type);
            }
        }
    }
}
