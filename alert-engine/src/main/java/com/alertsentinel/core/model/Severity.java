package com.alertsentinel.core.model;

import java.util.Locale;

/**
 * Severity attached to an {@link AlertRule}.
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    WARNING,
    INFO;

    /**
     * @return lowercase label used in notification payloads
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity from its case-insensitive name.
     *
     * @param value severity name, e.g. {@code "critical"}
     * @return the matching severity
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: critical, warning, info", e);
        }
    }
}
