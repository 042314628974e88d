package com.alertsentinel.core.config;

import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.Severity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML form of an {@link AlertRule}.
 *
 * <p>
 * Mutable bean populated by SnakeYAML; {@link #validate()} checks it and
 * {@link #toRule()} turns it into the immutable model type.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    private String id;
    private String name;
    private String description;
    private String severity;
    private boolean enabled = true;
    /** Cooldown in milliseconds; {@code null} means the model default. */
    private Long cooldownMs;
    private List<ConditionDefinition> conditions = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private Map<String, String> labels = new LinkedHashMap<>();
    private List<String> actions = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate this definition.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String owner = "Rule '" + (id != null ? id : "<no id>") + "'";

        if (id == null || id.isBlank()) {
            errors.add(owner + ": 'id' is required");
        }
        if (name == null || name.isBlank()) {
            errors.add(owner + ": 'name' is required");
        }
        if (severity == null || severity.isBlank()) {
            errors.add(owner + ": 'severity' is required");
        } else {
            try {
                Severity.fromString(severity);
            } catch (IllegalArgumentException e) {
                errors.add(owner + ": " + e.getMessage());
            }
        }
        if (cooldownMs != null && cooldownMs < 0) {
            errors.add(owner + ": 'cooldownMs' must be >= 0");
        }
        if (conditions == null || conditions.isEmpty()) {
            errors.add(owner + ": at least one condition is required");
        } else {
            for (int i = 0; i < conditions.size(); i++) {
                ConditionDefinition condition = conditions.get(i);
                if (condition == null) {
                    errors.add(owner + ": condition at index " + i + " is empty");
                } else {
                    condition.collectErrors(owner + " condition[" + i + "]", errors);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    /**
     * @return the model rule
     * @throws IllegalStateException if the definition is invalid
     */
    public AlertRule toRule() {
        validate();
        AlertRule.Builder builder = AlertRule.builder()
                .id(id)
                .name(name)
                .description(description)
                .severity(Severity.fromString(severity))
                .enabled(enabled)
                .tags(tags)
                .labels(labels)
                .actions(actions);
        if (cooldownMs != null) {
            builder.cooldown(Duration.ofMillis(cooldownMs));
        }
        conditions.forEach(c -> builder.condition(c.toCondition()));
        return builder.build();
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Long getCooldownMs() {
        return cooldownMs;
    }

    public void setCooldownMs(Long cooldownMs) {
        this.cooldownMs = cooldownMs;
    }

    public List<ConditionDefinition> getConditions() {
        return conditions;
    }

    public void setConditions(List<ConditionDefinition> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public void setLabels(Map<String, String> labels) {
        this.labels = labels != null ? new LinkedHashMap<>(labels) : new LinkedHashMap<>();
    }

    public List<String> getActions() {
        return actions;
    }

    public void setActions(List<String> actions) {
        this.actions = actions != null ? new ArrayList<>(actions) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "id='" + id + '\'' +
                ", severity='" + severity + '\'' +
                ", conditions=" + conditions +
                ", actions=" + actions +
                '}';
    }
}
