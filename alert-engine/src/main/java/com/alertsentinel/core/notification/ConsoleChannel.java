package com.alertsentinel.core.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Writes alerts to the application log. Needs no configuration.
 *
 * @since 1.0.0
 */
public class ConsoleChannel extends AbstractNotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleChannel.class);

    public ConsoleChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    @Override
    protected Optional<String> validateConfig() {
        return Optional.empty();
    }

    @Override
    protected CompletableFuture<NotificationResult> deliver(NotificationPayload payload) {
        String severity = payload.getSeverity().toUpperCase(Locale.ROOT);
        String ruleName = payload.getRule().getName();
        switch (payload.getRule().getSeverity()) {
            case CRITICAL -> LOG.error("[ALERT {}] {} (rule: {}, at: {})",
                    severity, payload.getMessage(), ruleName, payload.getTimestamp());
            case WARNING -> LOG.warn("[ALERT {}] {} (rule: {}, at: {})",
                    severity, payload.getMessage(), ruleName, payload.getTimestamp());
            default -> LOG.info("[ALERT {}] {} (rule: {}, at: {})",
                    severity, payload.getMessage(), ruleName, payload.getTimestamp());
        }
        return CompletableFuture.completedFuture(success());
    }
}
