package com.alertsentinel.core.config;

import com.alertsentinel.core.model.Aggregation;
import com.alertsentinel.core.model.AlertCondition;
import com.alertsentinel.core.model.ComparisonOperator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML form of an {@link AlertCondition}.
 *
 * <pre>
 * - metric: cpu
 *   operator: "&gt;"
 *   threshold: 80
 *   durationMs: 30000
 *   aggregation: average
 * </pre>
 *
 * @since 1.0.0
 */
public class ConditionDefinition {

    private String metric;
    private String operator;
    private Double threshold;
    private long durationMs;
    private String aggregation = "average";

    /**
     * Append every problem with this condition to {@code errors}.
     *
     * @param owner  label of the enclosing rule, used in messages
     * @param errors sink for problems
     */
    void collectErrors(String owner, List<String> errors) {
        if (metric == null || metric.isBlank()) {
            errors.add(owner + ": condition 'metric' is required");
        }
        if (operator == null || operator.isBlank()) {
            errors.add(owner + ": condition 'operator' is required");
        } else {
            try {
                ComparisonOperator.fromSymbol(operator);
            } catch (IllegalArgumentException e) {
                errors.add(owner + ": " + e.getMessage());
            }
        }
        if (threshold == null) {
            errors.add(owner + ": condition 'threshold' is required");
        } else if (threshold.isNaN()) {
            errors.add(owner + ": condition 'threshold' must be a number");
        }
        if (durationMs < 0) {
            errors.add(owner + ": condition 'durationMs' must be >= 0");
        }
        if (aggregation != null) {
            try {
                Aggregation.fromString(aggregation);
            } catch (IllegalArgumentException e) {
                errors.add(owner + ": " + e.getMessage());
            }
        }
    }

    /**
     * @return the condition; call only after validation passed
     */
    public AlertCondition toCondition() {
        List<String> errors = new ArrayList<>();
        collectErrors("Condition", errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
        return AlertCondition.builder()
                .metric(metric)
                .operator(operator)
                .threshold(threshold)
                .duration(Duration.ofMillis(durationMs))
                .aggregation(aggregation != null ? Aggregation.fromString(aggregation) : Aggregation.AVERAGE)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public String getAggregation() {
        return aggregation;
    }

    public void setAggregation(String aggregation) {
        this.aggregation = aggregation;
    }

    @Override
    public String toString() {
        return metric + " " + operator + " " + threshold
                + " for " + durationMs + "ms (" + aggregation + ")";
    }
}
