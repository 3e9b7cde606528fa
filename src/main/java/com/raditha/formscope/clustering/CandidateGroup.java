package com.raditha.formscope.clustering;

import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlSignature;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A control sequence being mined: its key, the signatures recorded on first
 * sight and the forms it has been seen in so far.
 */
public final class CandidateGroup {

    private final String groupId;
    private final List<ControlSignature> controls;
    private final Set<String> forms = new LinkedHashSet<>();

    public CandidateGroup(String groupId, List<ControlSignature> controls) {
        this.groupId = groupId;
        this.controls = List.copyOf(controls);
    }

    public String groupId() {
        return groupId;
    }

    public List<ControlSignature> controls() {
        return controls;
    }

    public Set<String> forms() {
        return Collections.unmodifiableSet(forms);
    }

    /**
     * Record that the group occurs in a form. Repeat sightings in the same
     * form are ignored.
     */
    public void addForm(String formId) {
        forms.add(formId);
    }

    /**
     * Take over the forms of a similar group.
     */
    public void absorb(CandidateGroup other) {
        forms.addAll(other.forms);
    }

    public int occurrenceCount() {
        return forms.size();
    }

    public int size() {
        return controls.size();
    }

    /**
     * Freeze into a named, immutable group.
     */
    public ControlGroup toControlGroup(String suggestedName) {
        return new ControlGroup(groupId, controls, forms, suggestedName, true, false, null);
    }
}
