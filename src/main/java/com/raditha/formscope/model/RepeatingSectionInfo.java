package com.raditha.formscope.model;

import java.util.List;

/**
 * Descriptor of a repeating section (or repeating table) found in a form.
 *
 * @param name         Section name
 * @param formName     Identifier of the owning form
 * @param controlCount Number of controls in the section
 * @param controlTypes Distinct control types in first-seen order
 */
public record RepeatingSectionInfo(
        String name,
        String formName,
        int controlCount,
        List<String> controlTypes) {

    public RepeatingSectionInfo {
        controlTypes = controlTypes == null ? List.of() : List.copyOf(controlTypes);
    }
}
