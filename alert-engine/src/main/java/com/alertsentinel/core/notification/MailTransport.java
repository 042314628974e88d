package com.alertsentinel.core.notification;

import java.io.IOException;

/**
 * Delivers rendered e-mails for {@link EmailChannel}. Implementations may
 * block; the channel calls them from the {@link ChannelSupport#executor()}.
 */
@FunctionalInterface
public interface MailTransport {

    /**
     * @param message the e-mail to send
     * @throws IOException if the message could not be handed to the mail
     *                     system
     */
    void send(EmailMessage message) throws IOException;
}
