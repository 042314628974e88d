package com.alertsentinel.core.notification;

import java.util.Optional;

/**
 * Generic webhook: POSTs the full {@link NotificationPayload} as JSON to the
 * configured {@code url}, with any extra {@code headers}.
 *
 * @since 1.0.0
 */
public class WebhookChannel extends AbstractHttpChannel {

    public WebhookChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    @Override
    protected Optional<String> validateConfig() {
        return config.getString("url") == null
                ? Optional.of("Webhook URL not configured")
                : Optional.empty();
    }

    @Override
    protected String targetUrl() {
        return config.getString("url");
    }

    @Override
    protected Object requestBody(NotificationPayload payload) {
        return payload;
    }
}
