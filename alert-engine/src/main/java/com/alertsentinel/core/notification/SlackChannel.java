package com.alertsentinel.core.notification;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Slack incoming webhook ({@code webhookUrl}). Optional {@code channel} and
 * {@code username} override the webhook defaults.
 *
 * @since 1.0.0
 */
public class SlackChannel extends AbstractHttpChannel {

    public SlackChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    @Override
    protected Optional<String> validateConfig() {
        return config.getString("webhookUrl") == null
                ? Optional.of("Slack webhook URL not configured")
                : Optional.empty();
    }

    @Override
    protected String targetUrl() {
        return config.getString("webhookUrl");
    }

    @Override
    protected Object requestBody(NotificationPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", ":rotating_light: *[" + payload.getSeverity().toUpperCase(Locale.ROOT) + "]* "
                + payload.getMessage());
        if (config.getString("channel") != null) {
            body.put("channel", config.getString("channel"));
        }
        if (config.getString("username") != null) {
            body.put("username", config.getString("username"));
        }
        return body;
    }
}
