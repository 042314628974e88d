package com.alertsentinel.core.evaluation;

import java.util.Objects;

/**
 * Delivery outcome for one notification channel of a triggered rule.
 *
 * @since 1.0.0
 */
public final class ChannelDelivery {

    private final String channelId;
    private final boolean success;
    private final String error;

    public ChannelDelivery(String channelId, boolean success, String error) {
        this.channelId = Objects.requireNonNull(channelId, "channelId must not be null");
        this.success = success;
        this.error = error;
    }

    public static ChannelDelivery succeeded(String channelId) {
        return new ChannelDelivery(channelId, true, null);
    }

    public static ChannelDelivery failed(String channelId, String error) {
        return new ChannelDelivery(channelId, false, error);
    }

    public String getChannelId() {
        return channelId;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return failure description, or {@code null} on success
     */
    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelDelivery that))
            return false;
        return success == that.success
                && channelId.equals(that.channelId)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelId, success, error);
    }

    @Override
    public String toString() {
        return success
                ? "ChannelDelivery{" + channelId + ": ok}"
                : "ChannelDelivery{" + channelId + ": failed, error='" + error + "'}";
    }
}
