package com.alertsentinel.core.model;

import java.util.List;
import java.util.Locale;
import java.util.stream.DoubleStream;

/**
 * Reduction applied to the sample series of a metric before it is compared
 * against a condition threshold.
 *
 * @since 1.0.0
 */
public enum Aggregation {

    AVERAGE,
    SUM,
    MIN,
    MAX,
    COUNT;

    /**
     * Reduce {@code values} to a single number.
     *
     * @param values sample series; an empty list yields {@code 0}
     * @return the aggregated value
     */
    public double apply(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0;
        }
        return switch (this) {
            case COUNT -> values.size();
            case SUM -> stream(values).sum();
            case MIN -> stream(values).min().orElse(0);
            case MAX -> stream(values).max().orElse(0);
            case AVERAGE -> stream(values).average().orElse(0);
        };
    }

    private static DoubleStream stream(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue);
    }

    /**
     * Parse an aggregation from its case-insensitive name; {@code "avg"} and
     * {@code "mean"} are accepted for {@link #AVERAGE}.
     *
     * @param value aggregation name
     * @return the matching aggregation
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Aggregation fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Aggregation must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("AVG".equals(normalized) || "MEAN".equals(normalized)) {
            return AVERAGE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation: '" + value
                    + "'. Supported: average, sum, min, max, count", e);
        }
    }
}
