package com.raditha.formscope.model;

/**
 * Identity of a control for mining purposes.
 * Two controls are the same signature when their type and normalized label
 * match, regardless of name, position or label casing.
 *
 * @param type            Control type tag
 * @param normalizedLabel Uppercase label with non-alphanumerics removed
 */
public record ControlKey(String type, String normalizedLabel) {

    /**
     * Key fragment used when building group keys: {@code Type_LABEL}.
     */
    public String toGroupKeyPart() {
        return type + "_" + normalizedLabel;
    }

    /**
     * Display form used in the frequency table: {@code Type:LABEL}.
     */
    @Override
    public String toString() {
        return type + ":" + normalizedLabel;
    }
}
