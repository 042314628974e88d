package com.alertsentinel.core.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates {@link NotificationChannel} instances from
 * {@link NotificationConfig}s.
 *
 * <p>
 * This is the single point of extension when adding a channel type:
 * add the constant to {@link ChannelType} and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChannelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelFactory.class);

    private ChannelFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a channel backed by one process-wide {@link ChannelSupport#defaults()}
     * instance, created on first use and shared by every channel built here.
     *
     * @see #create(NotificationConfig, ChannelSupport)
     */
    public static NotificationChannel create(NotificationConfig config) {
        return create(config, sharedDefaults());
    }

    static ChannelSupport sharedDefaults() {
        return DefaultSupportHolder.INSTANCE;
    }

    /**
     * Create the channel variant named by {@code config.getType()}.
     *
     * @param config  channel configuration; must not be {@code null}
     * @param support shared collaborators; must not be {@code null}
     * @return a new channel
     * @throws UnsupportedChannelTypeException if the type is missing
     */
    public static NotificationChannel create(NotificationConfig config, ChannelSupport support) {
        Objects.requireNonNull(config, "NotificationConfig must not be null");
        Objects.requireNonNull(support, "ChannelSupport must not be null");
        if (config.getType() == null) {
            throw new UnsupportedChannelTypeException("null");
        }

        NotificationChannel channel = switch (config.getType()) {
            case WEBHOOK -> new WebhookChannel(config, support);
            case EMAIL -> new EmailChannel(config, support);
            case SLACK -> new SlackChannel(config, support);
            case DISCORD -> new DiscordChannel(config, support);
            case PAGERDUTY -> new PagerDutyChannel(config, support);
            case CONSOLE -> new ConsoleChannel(config, support);
        };
        LOG.debug("Created {} channel [{}]", config.getType().tag(), config.getId());
        return channel;
    }

    private static final class DefaultSupportHolder {
        private static final ChannelSupport INSTANCE = ChannelSupport.defaults();
    }
}
