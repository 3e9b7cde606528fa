package com.raditha.formscope.extraction;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes control labels for comparison: non-alphanumerics removed,
 * uppercased.
 */
public final class LabelNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");

    private LabelNormalizer() {
    }

    /**
     * @param label Label text, may be null
     * @return Normalized label, empty for blank input
     */
    public static String normalize(String label) {
        if (label == null || label.isBlank()) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(label).replaceAll("").toUpperCase(Locale.ROOT);
    }
}
