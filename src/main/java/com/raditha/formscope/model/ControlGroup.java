package com.raditha.formscope.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A contiguous sequence of controls that recurs across several forms and is a
 * candidate for a reusable component.
 *
 * @param groupId                   Key derived from the control signatures
 * @param controls                  Ordered control signatures
 * @param foundInForms              Identifiers of the forms containing the group
 * @param suggestedName             Generated component name
 * @param sequential                Controls appear consecutively in each form
 * @param containsRepeatingControls Group includes repeating-section controls
 * @param commonSection             Section shared by all controls, or null
 */
public record ControlGroup(
        String groupId,
        List<ControlSignature> controls,
        Set<String> foundInForms,
        String suggestedName,
        boolean sequential,
        boolean containsRepeatingControls,
        String commonSection) {

    public ControlGroup {
        controls = List.copyOf(controls);
        foundInForms = Collections.unmodifiableSet(new LinkedHashSet<>(foundInForms));
    }

    /**
     * Number of distinct forms containing this group.
     */
    public int occurrenceCount() {
        return foundInForms.size();
    }

    /**
     * Number of controls in this group.
     */
    public int size() {
        return controls.size();
    }

    /**
     * Format group summary for display.
     */
    public String formatSummary() {
        return String.format("%s: %d controls in %d forms", suggestedName, size(), occurrenceCount());
    }
}
