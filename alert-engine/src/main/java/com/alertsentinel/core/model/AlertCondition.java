package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * A single threshold test against the aggregated value of one metric.
 *
 * <p>
 * The condition counts as met only after its comparison has held
 * continuously for at least {@link #getDuration()}. A zero duration means the
 * condition is met on the first evaluation where the comparison holds.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #of(String, ComparisonOperator, double)}
 * for the common case or the {@link Builder} for the full set of options.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertCondition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final ComparisonOperator operator;
    private final double threshold;
    private final Duration duration;
    private final Aggregation aggregation;

    private AlertCondition(Builder builder) {
        this.metric = requireNonBlank(builder.metric);
        this.operator = Objects.requireNonNull(builder.operator, "operator must not be null");
        this.threshold = builder.threshold;
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
        this.aggregation = builder.aggregation != null ? builder.aggregation : Aggregation.AVERAGE;

        if (duration.isNegative()) {
            throw new IllegalArgumentException(
                    "duration must not be negative for metric '" + metric + "', got: " + duration);
        }
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be a number for metric '" + metric + "'");
        }
    }

    /**
     * Condition with zero duration and {@link Aggregation#AVERAGE}.
     */
    public static AlertCondition of(String metric, ComparisonOperator operator, double threshold) {
        return builder().metric(metric).operator(operator).threshold(threshold).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertCondition}. {@code metric} and
     * {@code operator} are required.
     */
    public static class Builder {
        private String metric;
        private ComparisonOperator operator;
        private double threshold;
        private Duration duration;
        private Aggregation aggregation;

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder operator(ComparisonOperator operator) {
            this.operator = operator;
            return this;
        }

        public Builder operator(String symbol) {
            this.operator = ComparisonOperator.fromSymbol(symbol);
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        /**
         * @return a new {@link AlertCondition}
         * @throws IllegalArgumentException if {@code metric} is blank or the
         *                                  duration is negative
         * @throws NullPointerException     if {@code operator} is missing
         */
        public AlertCondition build() {
            return new AlertCondition(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public double getThreshold() {
        return threshold;
    }

    public Duration getDuration() {
        return duration;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    private static String requireNonBlank(String metric) {
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("Condition 'metric' must not be null or blank");
        }
        return metric;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertCondition that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && metric.equals(that.metric)
                && operator == that.operator
                && duration.equals(that.duration)
                && aggregation == that.aggregation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, operator, threshold, duration, aggregation);
    }

    @Override
    public String toString() {
        return aggregation.name().toLowerCase(Locale.ROOT) + "(" + metric + ") " + operator.symbol() + " " + threshold
                + (duration.isZero() ? "" : " for " + duration);
    }
}
