package com.alertsentinel.core.notification;

import java.util.Locale;

/**
 * Supported notification channel variants.
 *
 * @since 1.0.0
 */
public enum ChannelType {

    WEBHOOK,
    EMAIL,
    SLACK,
    DISCORD,
    PAGERDUTY,
    CONSOLE;

    /**
     * @return lowercase type tag as written in configuration
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a type tag case-insensitively.
     *
     * @param type type tag, e.g. {@code "webhook"}
     * @return the matching channel type
     * @throws UnsupportedChannelTypeException if the tag is {@code null},
     *                                         blank or unknown
     */
    public static ChannelType fromString(String type) {
        if (type == null || type.isBlank()) {
            throw new UnsupportedChannelTypeException(String.valueOf(type));
        }
        String normalized = type.trim().toUpperCase(Locale.ROOT);
        if ("PAGER_DUTY".equals(normalized)) {
            return PAGERDUTY;
        }
        for (ChannelType candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new UnsupportedChannelTypeException(type);
    }
}
