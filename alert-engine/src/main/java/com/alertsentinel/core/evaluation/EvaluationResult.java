package com.alertsentinel.core.evaluation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one rule against one {@link EvaluationContext}.
 *
 * <p>
 * A result produced by {@link RuleEvaluator} carries no deliveries. When the
 * alert manager dispatches notifications for a triggered rule it returns a
 * copy with the per-channel outcomes attached (see
 * {@link #withDeliveries(List)}), so callers can tell "not met",
 * "triggered but delivery failed" and "triggered and delivered" apart.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationResult {

    private final String ruleId;
    private final boolean triggered;
    private final List<ConditionEvaluationResult> conditions;
    private final Instant timestamp;
    private final String message;
    private final List<ChannelDelivery> deliveries;

    public EvaluationResult(String ruleId, boolean triggered, List<ConditionEvaluationResult> conditions,
            Instant timestamp, String message) {
        this(ruleId, triggered, conditions, timestamp, message, List.of());
    }

    private EvaluationResult(String ruleId, boolean triggered, List<ConditionEvaluationResult> conditions,
            Instant timestamp, String message, List<ChannelDelivery> deliveries) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.triggered = triggered;
        this.conditions = List.copyOf(conditions);
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.message = message;
        this.deliveries = List.copyOf(deliveries);
    }

    /**
     * @param deliveries per-channel outcomes, in notification order
     * @return a copy of this result carrying {@code deliveries}
     */
    public EvaluationResult withDeliveries(List<ChannelDelivery> deliveries) {
        return new EvaluationResult(ruleId, triggered, conditions, timestamp, message, deliveries);
    }

    public String getRuleId() {
        return ruleId;
    }

    public boolean isTriggered() {
        return triggered;
    }

    public List<ConditionEvaluationResult> getConditions() {
        return conditions;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return trigger message, or {@code null} if the rule did not trigger
     */
    public String getMessage() {
        return message;
    }

    public List<ChannelDelivery> getDeliveries() {
        return deliveries;
    }

    /**
     * @return {@code true} if the rule triggered and every attempted channel
     *         reported success
     */
    public boolean isFullyDelivered() {
        return triggered && deliveries.stream().allMatch(ChannelDelivery::isSuccess);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "ruleId='" + ruleId + '\'' +
                ", triggered=" + triggered +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                ", deliveries=" + deliveries +
                '}';
    }
}
