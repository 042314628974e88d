package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.AlertCondition;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of evaluating one {@link AlertCondition}.
 *
 * @since 1.0.0
 */
public final class ConditionEvaluationResult {

    private final AlertCondition condition;
    private final double actualValue;
    private final boolean met;
    private final Duration duration;

    public ConditionEvaluationResult(AlertCondition condition, double actualValue, boolean met, Duration duration) {
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.actualValue = actualValue;
        this.met = met;
        this.duration = Objects.requireNonNull(duration, "duration must not be null");
    }

    public AlertCondition getCondition() {
        return condition;
    }

    /** Aggregated metric value; {@code 0} when the metric had no samples. */
    public double getActualValue() {
        return actualValue;
    }

    public double getThreshold() {
        return condition.getThreshold();
    }

    /** {@code true} when the comparison held for at least the required duration. */
    public boolean isMet() {
        return met;
    }

    /** How long the comparison has held continuously, zero if it does not hold. */
    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "ConditionEvaluationResult{" +
                "condition=" + condition +
                ", actualValue=" + actualValue +
                ", met=" + met +
                ", duration=" + duration +
                '}';
    }
}
