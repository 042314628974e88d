package com.alertsentinel.core.notification;

/**
 * Thrown when a notification configuration names a channel type the
 * {@link ChannelFactory} does not know.
 *
 * @since 1.0.0
 */
public class UnsupportedChannelTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public UnsupportedChannelTypeException(String type) {
        super("Unsupported channel type: '" + type
                + "'. Supported types: webhook, email, slack, discord, pagerduty, console");
    }
}
