package com.alertsentinel.core.config;

import com.alertsentinel.core.notification.ChannelType;
import com.alertsentinel.core.notification.NotificationConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML form of a {@link NotificationConfig}.
 *
 * @since 1.0.0
 */
public class ChannelDefinition {

    private String id;
    private String name;
    private String type;
    private boolean enabled = true;
    private Map<String, Object> config = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String owner = "Channel '" + (id != null ? id : "<no id>") + "'";

        if (id == null || id.isBlank()) {
            errors.add(owner + ": 'id' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add(owner + ": 'type' is required");
        } else {
            try {
                ChannelType.fromString(type);
            } catch (IllegalArgumentException e) {
                errors.add(owner + ": " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    /**
     * @return the notification config
     * @throws IllegalStateException if the definition is invalid
     */
    public NotificationConfig toNotificationConfig() {
        validate();
        return NotificationConfig.builder()
                .id(id)
                .name(name)
                .type(type)
                .enabled(enabled)
                .config(config)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ChannelDefinition{id='" + id + "', type='" + type + "', enabled=" + enabled + '}';
    }
}
