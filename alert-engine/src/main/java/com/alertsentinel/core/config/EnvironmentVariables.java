package com.alertsentinel.core.config;

import java.util.Locale;

/**
 * Environment lookups shared by the {@code fromEnvironment()} factories.
 */
final class EnvironmentVariables {

    private EnvironmentVariables() {
        // utility class — not instantiable
    }

    static String get(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static boolean getBoolean(String name, boolean defaultValue) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalStateException(
                    "Environment variable " + name + " must be a boolean, got: " + value);
        };
    }
}
