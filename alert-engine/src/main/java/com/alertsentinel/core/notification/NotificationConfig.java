package com.alertsentinel.core.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one notification channel.
 *
 * <p>
 * The free-form {@link #getConfig() config} map carries the variant-specific
 * settings, e.g. {@code url} for a webhook or {@code to} for email. Which
 * keys are required is checked by the channel itself when it sends, not
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class NotificationConfig {

    private final String id;
    private final String name;
    private final ChannelType type;
    private final boolean enabled;
    private final Map<String, Object> config;

    private NotificationConfig(Builder b) {
        this.id = b.id;
        this.name = b.name != null ? b.name : b.id;
        this.type = b.type;
        this.enabled = b.enabled;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(b.config));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; {@code id} and {@code type} are required.
     */
    public static class Builder {
        private String id;
        private String name;
        private ChannelType type;
        private boolean enabled = true;
        private final Map<String, Object> config = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(ChannelType type) {
            this.type = type;
            return this;
        }

        /**
         * @throws UnsupportedChannelTypeException if the tag is unknown
         */
        public Builder type(String type) {
            this.type = ChannelType.fromString(type);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(Objects.requireNonNull(key, "config key must not be null"), value);
            return this;
        }

        public Builder config(Map<String, ?> config) {
            this.config.clear();
            if (config != null) {
                this.config.putAll(config);
            }
            return this;
        }

        /**
         * @return a new {@link NotificationConfig}
         * @throws IllegalArgumentException        if {@code id} is blank
         * @throws UnsupportedChannelTypeException if {@code type} is missing
         */
        public NotificationConfig build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Channel 'id' must not be null or blank");
            }
            if (type == null) {
                throw new UnsupportedChannelTypeException("null");
            }
            return new NotificationConfig(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ChannelType getType() {
        return type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * @param key config key
     * @return the trimmed string value, or {@code null} if absent or blank
     */
    public String getString(String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    @Override
    public String toString() {
        return "NotificationConfig{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", enabled=" + enabled +
                ", configKeys=" + config.keySet() +
                '}';
    }
}
