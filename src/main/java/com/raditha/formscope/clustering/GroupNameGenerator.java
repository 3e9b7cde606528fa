package com.raditha.formscope.clustering;

import com.raditha.formscope.model.ControlSignature;

import java.util.List;
import java.util.Locale;

/**
 * Suggests a name for a control group from its labels.
 * <p>
 * Labels are checked against keyword families in a fixed priority order. A
 * family matches when at least half of its keywords (rounded down) appear in
 * the joined, lower-cased labels. Groups matching no family are named after
 * their first and last labels.
 */
public class GroupNameGenerator {

    private static final String FALLBACK_PREFIX = "ControlGroup_";
    private static final int FALLBACK_ID_LENGTH = 8;

    private record KeywordFamily(List<String> keywords, String name) {
        boolean matches(String labels) {
            long hits = keywords.stream().filter(labels::contains).count();
            return hits >= keywords.size() / 2;
        }
    }

    private static final List<KeywordFamily> FAMILIES = List.of(
            new KeywordFamily(List.of("first", "last", "name"), "NameFields"),
            new KeywordFamily(List.of("address", "city", "state", "zip"), "AddressFields"),
            new KeywordFamily(List.of("email", "phone"), "ContactFields"),
            new KeywordFamily(List.of("department", "division", "unit"), "OrganizationFields"),
            new KeywordFamily(List.of("date", "time"), "DateTimeFields"));

    /**
     * Suggest a name for a group.
     *
     * @param groupId  Group key, used when no control carries a label
     * @param controls Controls of the group
     * @return Suggested name, never null
     */
    public String generateName(String groupId, List<ControlSignature> controls) {
        List<String> labels = controls.stream()
                .filter(ControlSignature::hasLabel)
                .map(ControlSignature::label)
                .toList();

        if (labels.isEmpty()) {
            return FALLBACK_PREFIX + groupId.substring(0, Math.min(FALLBACK_ID_LENGTH, groupId.length()));
        }

        String joined = String.join(" ", labels).toLowerCase(Locale.ROOT);
        for (KeywordFamily family : FAMILIES) {
            if (family.matches(joined)) {
                return family.name();
            }
        }

        String first = labels.get(0).replace(" ", "");
        if (labels.size() == 1) {
            return first + "Group";
        }
        return first + "To" + labels.get(labels.size() - 1).replace(" ", "");
    }
}
