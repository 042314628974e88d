package com.alertsentinel.core.evaluation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of recent metric samples handed to one evaluation pass.
 *
 * <p>
 * Each metric maps to an ordered series of samples (oldest first). The
 * snapshot is immutable: the maps and lists passed in are copied.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationContext {

    private final Map<String, List<Double>> metricValues;
    private final Instant timestamp;

    private EvaluationContext(Map<String, List<Double>> metricValues, Instant timestamp) {
        this.metricValues = metricValues;
        this.timestamp = timestamp;
    }

    /**
     * Create a context from a metric map.
     *
     * @param metricValues metric name to sample series; must not contain
     *                     {@code null} samples
     * @param timestamp    evaluation instant
     * @return immutable context
     * @throws NullPointerException if any argument or sample is {@code null}
     */
    public static EvaluationContext of(Map<String, ? extends List<Double>> metricValues, Instant timestamp) {
        Objects.requireNonNull(metricValues, "metricValues must not be null");
        Builder builder = builder().timestamp(timestamp);
        metricValues.forEach(builder::samples);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; {@code timestamp} is required.
     */
    public static class Builder {
        private final Map<String, List<Double>> metricValues = new LinkedHashMap<>();
        private Instant timestamp;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /** Append samples to a metric's series. */
        public Builder sample(String metric, double... values) {
            List<Double> series = metricValues.computeIfAbsent(
                    Objects.requireNonNull(metric, "metric must not be null"), k -> new ArrayList<>());
            for (double v : values) {
                series.add(v);
            }
            return this;
        }

        /** Replace a metric's series. */
        public Builder samples(String metric, List<Double> values) {
            Objects.requireNonNull(metric, "metric must not be null");
            Objects.requireNonNull(values, "samples for '" + metric + "' must not be null");
            List<Double> series = new ArrayList<>(values.size());
            for (Double v : values) {
                series.add(Objects.requireNonNull(v, "samples for '" + metric + "' must not contain null"));
            }
            metricValues.put(metric, series);
            return this;
        }

        public EvaluationContext build() {
            Objects.requireNonNull(timestamp, "timestamp must not be null");
            Map<String, List<Double>> copy = new LinkedHashMap<>();
            metricValues.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new EvaluationContext(Collections.unmodifiableMap(copy), timestamp);
        }
    }

    /**
     * @param metric metric name
     * @return the metric's samples, or an empty list if absent
     */
    public List<Double> getValues(String metric) {
        return metricValues.getOrDefault(metric, List.of());
    }

    public Map<String, List<Double>> getMetricValues() {
        return metricValues;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "EvaluationContext{timestamp=" + timestamp + ", metrics=" + metricValues.keySet() + '}';
    }
}
