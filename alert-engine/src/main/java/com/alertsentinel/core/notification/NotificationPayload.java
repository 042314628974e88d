package com.alertsentinel.core.notification;

import com.alertsentinel.core.model.AlertRule;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a channel needs to render one alert notification.
 *
 * @since 1.0.0
 */
public final class NotificationPayload {

    private final AlertRule rule;
    private final String message;
    private final Instant timestamp;
    private final String severity;
    private final Map<String, Object> metadata;

    public NotificationPayload(AlertRule rule, String message, Instant timestamp, Map<String, Object> metadata) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.severity = rule.getSeverity().label();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public AlertRule getRule() {
        return rule;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /** Lowercase severity label, e.g. {@code "critical"}. */
    public String getSeverity() {
        return severity;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "NotificationPayload{" +
                "ruleId='" + rule.getId() + '\'' +
                ", severity='" + severity + '\'' +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                '}';
    }
}
