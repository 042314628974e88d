package com.alertsentinel.core.notification;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * PagerDuty Events API v2. Sends a {@code trigger} event keyed by the rule
 * id, so repeated triggers of one rule group into a single incident.
 *
 * <p>
 * Requires {@code routingKey}; {@code url} overrides the public endpoint.
 * </p>
 *
 * @since 1.0.0
 */
public class PagerDutyChannel extends AbstractHttpChannel {

    static final String DEFAULT_EVENTS_URL = "https://events.pagerduty.com/v2/enqueue";

    public PagerDutyChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    @Override
    protected Optional<String> validateConfig() {
        return config.getString("routingKey") == null
                ? Optional.of("PagerDuty routing key not configured")
                : Optional.empty();
    }

    @Override
    protected String targetUrl() {
        String url = config.getString("url");
        return url != null ? url : DEFAULT_EVENTS_URL;
    }

    @Override
    protected Object requestBody(NotificationPayload payload) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ruleName", payload.getRule().getName());
        details.put("labels", payload.getRule().getLabels());
        details.put("tags", payload.getRule().getTags());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("summary", payload.getMessage());
        event.put("source", config.getString("source") != null ? config.getString("source") : "alert-sentinel");
        // Events API accepts critical, error, warning and info
        event.put("severity", payload.getSeverity());
        event.put("timestamp", payload.getTimestamp().toString());
        event.put("custom_details", details);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("routing_key", config.getString("routingKey"));
        body.put("event_action", "trigger");
        body.put("dedup_key", payload.getRule().getId());
        body.put("payload", event);
        return body;
    }
}
