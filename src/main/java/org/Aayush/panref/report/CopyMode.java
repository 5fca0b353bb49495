package org.Aayush.panref.report;

import java.util.Locale;

/**
 * How a copied address takes over the references of its source.
 */
public enum CopyMode {
    /** The copy joins every group and rule next to the source. */
    ADD,
    /** The copy takes the place of the source. */
    REPLACE;

    /**
     * Parses {@code add} or {@code replace}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value.
     */
    public static CopyMode parse(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (CopyMode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("copy mode must be 'add' or 'replace', got '" + value + "'");
    }
}
