package com.alertsentinel.core.notification;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * E-mail channel. Renders the alert and hands it to the configured
 * {@link MailTransport} on the shared executor.
 *
 * <p>
 * Requires {@code to} (comma-separated addresses). Optional {@code from}
 * and {@code subjectPrefix} (default {@code [Alert]}).
 * </p>
 *
 * @since 1.0.0
 */
public class EmailChannel extends AbstractNotificationChannel {

    public EmailChannel(NotificationConfig config, ChannelSupport support) {
        super(config, support);
    }

    @Override
    protected Optional<String> validateConfig() {
        return recipients().isEmpty()
                ? Optional.of("Email recipient not configured")
                : Optional.empty();
    }

    @Override
    protected CompletableFuture<NotificationResult> deliver(NotificationPayload payload) {
        EmailMessage message = render(payload);
        MailTransport transport = support.mailTransport();
        return CompletableFuture.supplyAsync(() -> {
            try {
                transport.send(message);
                return success();
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, support.executor());
    }

    EmailMessage render(NotificationPayload payload) {
        String prefix = config.getString("subjectPrefix") != null ? config.getString("subjectPrefix") : "[Alert]";
        String subject = prefix + " " + payload.getSeverity().toUpperCase(Locale.ROOT) + ": "
                + payload.getRule().getName();

        StringBuilder body = new StringBuilder()
                .append(payload.getMessage()).append("\n\n")
                .append("Rule: ").append(payload.getRule().getName())
                .append(" (").append(payload.getRule().getId()).append(")\n")
                .append("Severity: ").append(payload.getSeverity()).append('\n')
                .append("Time: ").append(DateTimeFormatter.ISO_INSTANT.format(payload.getTimestamp())).append('\n');
        if (!payload.getRule().getDescription().isEmpty()) {
            body.append('\n').append(payload.getRule().getDescription()).append('\n');
        }
        return new EmailMessage(config.getString("from"), recipients(), subject, body.toString());
    }

    private List<String> recipients() {
        String to = config.getString("to");
        if (to == null) {
            return List.of();
        }
        return Arrays.stream(to.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
