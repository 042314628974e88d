package com.alertsentinel.core.notification;

import java.util.List;
import java.util.Objects;

/**
 * A rendered alert e-mail, handed to a {@link MailTransport}.
 *
 * @since 1.0.0
 */
public final class EmailMessage {

    private final String from;
    private final List<String> to;
    private final String subject;
    private final String body;

    public EmailMessage(String from, List<String> to, String subject, String body) {
        this.from = from;
        this.to = List.copyOf(Objects.requireNonNull(to, "to must not be null"));
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
        if (this.to.isEmpty()) {
            throw new IllegalArgumentException("E-mail requires at least one recipient");
        }
    }

    /** Sender address, or {@code null} to let the transport decide. */
    public String getFrom() {
        return from;
    }

    public List<String> getTo() {
        return to;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "EmailMessage{to=" + to + ", subject='" + subject + "'}";
    }
}
