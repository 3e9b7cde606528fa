package com.raditha.formscope.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * A single control of a form view as supplied by the form model provider.
 *
 * @param name                 Internal control name
 * @param type                 Control type tag, e.g. "TextField", "Label"
 * @param label                Display label, may be null
 * @param binding              Data binding path
 * @param sectionType          Section type tag, "repeating" for repeating
 *                             content
 * @param parentSection        Name of the enclosing section
 * @param mergedIntoParent     Control was merged into its parent control
 * @param inRepeatingSection   Control sits inside a repeating section
 * @param repeatingSectionName Name of the enclosing repeating section
 * @param controls             Nested child controls (repeating tables)
 */
public record ControlDefinition(
        String name,
        String type,
        String label,
        String binding,
        String sectionType,
        String parentSection,
        @JsonAlias("isMergedIntoParent") boolean mergedIntoParent,
        @JsonAlias("isInRepeatingSection") boolean inRepeatingSection,
        String repeatingSectionName,
        List<ControlDefinition> controls) {

    public static final String REPEATING_SECTION_TYPE = "repeating";

    public ControlDefinition {
        controls = controls == null ? List.of() : List.copyOf(controls);
    }

    /**
     * Create a plain control with no section information.
     */
    public static ControlDefinition of(String name, String type, String label) {
        return new ControlDefinition(name, type, label, null, null, null, false, false, null, List.of());
    }

    /**
     * Create a control that sits inside a named repeating section.
     */
    public static ControlDefinition repeating(String name, String type, String label, String section) {
        return new ControlDefinition(name, type, label, null, REPEATING_SECTION_TYPE, section, false, true,
                section, List.of());
    }

    /**
     * Label if set, otherwise the control name.
     */
    public String displayLabel() {
        return label != null ? label : name;
    }

    /**
     * Check whether this control is repeating content, either by flag or by
     * section type.
     */
    public boolean isRepeating() {
        return inRepeatingSection || REPEATING_SECTION_TYPE.equals(sectionType);
    }
}
