package com.alertsentinel.core.manager;

import com.alertsentinel.core.evaluation.ChannelDelivery;
import com.alertsentinel.core.model.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One triggered alert as recorded in the manager's bounded history.
 *
 * @since 1.0.0
 */
public final class AlertHistoryEntry {

    private final String ruleId;
    private final Severity severity;
    private final Instant timestamp;
    private final boolean triggered;
    private final String message;
    private final List<ChannelDelivery> deliveries;

    public AlertHistoryEntry(String ruleId, Severity severity, Instant timestamp, boolean triggered,
            String message, List<ChannelDelivery> deliveries) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.triggered = triggered;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.deliveries = List.copyOf(deliveries);
    }

    public String getRuleId() {
        return ruleId;
    }

    /** Severity of the rule when it fired. */
    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isTriggered() {
        return triggered;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return one entry per channel the alert was sent to, in the rule's
     *         action order; skipped (missing or disabled) channels are absent
     */
    public List<ChannelDelivery> getDeliveries() {
        return deliveries;
    }

    @Override
    public String toString() {
        return "AlertHistoryEntry{" +
                "ruleId='" + ruleId + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                ", deliveries=" + deliveries +
                '}';
    }
}
