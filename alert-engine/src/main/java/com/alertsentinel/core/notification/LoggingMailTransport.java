package com.alertsentinel.core.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MailTransport} that writes e-mails to the log instead of sending
 * them. Used when no real transport is configured.
 *
 * @since 1.0.0
 */
public class LoggingMailTransport implements MailTransport {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingMailTransport.class);

    @Override
    public void send(EmailMessage message) {
        LOG.info("[Email] to={} subject='{}'\n{}", message.getTo(), message.getSubject(), message.getBody());
    }
}
