package com.raditha.formscope.model;

/**
 * Value types an expression or a catalog function can produce.
 * Each constant carries the lowercase name used in reports and exports.
 */
public enum ValueType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATE_TIME("dateTime"),
    NODESET("nodeset"),
    UNKNOWN("unknown");

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a value type from its label (case-insensitive).
     *
     * @param label the label, e.g. "dateTime"
     * @return matching type, UNKNOWN if none matches
     */
    public static ValueType fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (ValueType type : values()) {
            if (type.label.equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return label;
    }
}
