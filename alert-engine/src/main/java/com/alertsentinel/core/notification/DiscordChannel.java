package com.alertsentinel.core.notification;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Discord webhook ({@code webhookUrl}).
 *
 * @since 1.0.0
 */
public class DiscordChannel extends AbstractHttpChannel {

    /** Discord rejects message content longer than this. */
    static final int MAX_CONTENT_LENGTH = 2_000;

    public DiscordChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    @Override
    protected Optional<String> validateConfig() {
        return config.getString("webhookUrl") == null
                ? Optional.of("Discord webhook URL not configured")
                : Optional.empty();
    }

    @Override
    protected String targetUrl() {
        return config.getString("webhookUrl");
    }

    @Override
    protected Object requestBody(NotificationPayload payload) {
        String prefix = "critical".equals(payload.getSeverity()) ? "🚨" : "⚠️";
        String content = prefix + " **[" + payload.getSeverity().toUpperCase(Locale.ROOT) + "]** "
                + payload.getMessage();
        if (content.length() > MAX_CONTENT_LENGTH) {
            content = content.substring(0, MAX_CONTENT_LENGTH - 3) + "...";
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        if (config.getString("username") != null) {
            body.put("username", config.getString("username"));
        }
        return body;
    }
}
