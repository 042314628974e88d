package com.alertsentinel.core.notification;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one {@link NotificationChannel#send} call.
 *
 * @since 1.0.0
 */
public final class NotificationResult {

    private final boolean success;
    private final String channelId;
    private final Instant timestamp;
    private final String error;

    private NotificationResult(boolean success, String channelId, Instant timestamp, String error) {
        this.success = success;
        this.channelId = Objects.requireNonNull(channelId, "channelId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.error = error;
    }

    public static NotificationResult success(String channelId, Instant timestamp) {
        return new NotificationResult(true, channelId, timestamp, null);
    }

    public static NotificationResult failure(String channelId, Instant timestamp, String error) {
        return new NotificationResult(false, channelId, timestamp,
                Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public String getChannelId() {
        return channelId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return failure description, or {@code null} on success
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "NotificationResult{" +
                "success=" + success +
                ", channelId='" + channelId + '\'' +
                ", timestamp=" + timestamp +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
