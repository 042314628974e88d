package com.alertsentinel.core.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base class for the built-in channels.
 *
 * <p>
 * {@link #send} first asks the variant to {@link #validateConfig() validate}
 * its settings, then calls {@link #deliver}. Exceptions thrown by
 * {@code deliver} and exceptional completion of its future are both turned
 * into failure results, so callers never see an exception.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractNotificationChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractNotificationChannel.class);

    protected final NotificationConfig config;
    protected final ChannelSupport support;

    protected AbstractNotificationChannel(NotificationConfig config, ChannelSupport support) {
        this.config = Objects.requireNonNull(config, "NotificationConfig must not be null");
        this.support = Objects.requireNonNull(support, "ChannelSupport must not be null");
    }

    @Override
    public final CompletableFuture<NotificationResult> send(NotificationPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");

        Optional<String> configError = validateConfig();
        if (configError.isPresent()) {
            LOG.warn("Channel [{}] not sending: {}", getId(), configError.get());
            return CompletableFuture.completedFuture(failure(configError.get()));
        }

        CompletableFuture<NotificationResult> delivery;
        try {
            delivery = deliver(payload);
        } catch (RuntimeException e) {
            LOG.warn("Channel [{}] failed to send: {}", getId(), describe(e));
            return CompletableFuture.completedFuture(failure(describe(e)));
        }
        return delivery.exceptionally(e -> {
            Throwable cause = unwrap(e);
            LOG.warn("Channel [{}] delivery failed: {}", getId(), describe(cause));
            return failure(describe(cause));
        });
    }

    /**
     * Check the variant-specific settings.
     *
     * @return a description of the first problem, or empty if the channel
     *         can send
     */
    protected abstract Optional<String> validateConfig();

    /**
     * Perform the delivery. Called only after {@link #validateConfig()}
     * passed.
     *
     * @param payload the alert to deliver
     * @return future completing with the outcome
     */
    protected abstract CompletableFuture<NotificationResult> deliver(NotificationPayload payload);

    protected NotificationResult success() {
        return NotificationResult.success(getId(), support.clock().instant());
    }

    protected NotificationResult failure(String error) {
        return NotificationResult.failure(getId(), support.clock().instant(), error);
    }

    // ---------------------------------------------------------------
    // NotificationChannel
    // ---------------------------------------------------------------

    @Override
    public String getId() {
        return config.getId();
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public ChannelType getType() {
        return config.getType();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + getId() + "', enabled=" + isEnabled() + '}';
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
