package com.alertsentinel.core.notification;

import java.util.concurrent.CompletableFuture;

/**
 * Contract for all notification channels.
 *
 * <p>
 * {@link #send(NotificationPayload)} is asynchronous and must not throw:
 * missing configuration and transport failures are reported as a
 * {@link NotificationResult} with {@code success = false}. Implementations
 * are created by {@link ChannelFactory}.
 * </p>
 */
public interface NotificationChannel {

    String getId();

    String getName();

    ChannelType getType();

    boolean isEnabled();

    /**
     * Deliver a notification.
     *
     * @param payload the alert to deliver
     * @return a future that completes with the delivery outcome
     */
    CompletableFuture<NotificationResult> send(NotificationPayload payload);
}
