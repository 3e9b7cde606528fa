package com.raditha.formscope.model;

/**
 * A control as it appears in a form's extracted control sequence.
 *
 * @param label            Display label (falls back to the control name)
 * @param type             Control type tag (open domain, e.g. "TextField")
 * @param name             Internal control name
 * @param relativePosition Zero-based position within the form's sequence
 * @param normalizedLabel  Uppercase label with non-alphanumerics removed
 */
public record ControlSignature(
        String label,
        String type,
        String name,
        int relativePosition,
        String normalizedLabel) {

    /**
     * Get the mining identity of this control.
     */
    public ControlKey key() {
        return new ControlKey(type, normalizedLabel);
    }

    /**
     * Check whether this control has a non-blank label.
     */
    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
