package com.alertsentinel.core.detection;

import java.time.Instant;
import java.util.Objects;

/**
 * A statistical anomaly observed on one metric.
 *
 * <p>
 * Anomalies are transient values handed back to the caller of
 * {@link AnomalyDetector#detect}; the engine does not keep them.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly {

    private final AnomalyType type;
    private final String metric;
    private final Instant timestamp;
    private final double value;
    private final double expectedValue;
    private final double deviation;
    private final double confidence;
    private final String description;

    public Anomaly(AnomalyType type, String metric, Instant timestamp, double value,
            double expectedValue, double deviation, double confidence, String description) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.expectedValue = expectedValue;
        this.deviation = deviation;
        this.confidence = confidence;
        this.description = description;
    }

    public AnomalyType getType() {
        return type;
    }

    public String getMetric() {
        return metric;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /** Rolling mean of the metric's window. */
    public double getExpectedValue() {
        return expectedValue;
    }

    /**
     * Distance from normal: standard deviations for spike/drop/outlier, slope
     * difference for a trend change.
     */
    public double getDeviation() {
        return deviation;
    }

    /** Confidence in [0, 1]. */
    public double getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "type=" + type +
                ", metric='" + metric + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", expectedValue=" + expectedValue +
                ", deviation=" + deviation +
                ", confidence=" + confidence +
                '}';
    }
}
