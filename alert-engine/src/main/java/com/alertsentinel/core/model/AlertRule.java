package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A user-defined alert rule: a conjunction of {@link AlertCondition}s plus
 * the metadata needed to route and throttle its notifications.
 *
 * <h3>Construction</h3>
 * <p>
 * Rules are created only through {@link #builder()}. The builder requires
 * {@code id}, {@code name}, {@code severity} and at least one condition;
 * anything else is defaulted (enabled, five-minute cooldown, empty
 * collections, {@link AlertState#PENDING}).
 * </p>
 *
 * <h3>Mutability</h3>
 * <p>
 * Configuration fields are fixed after {@code build()}. Only the lifecycle
 * fields ({@code state}, {@code lastTriggered}) change in place, driven by
 * the alert manager that owns the rule. Configuration changes go through
 * {@link #toBuilder()} and produce a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Cooldown applied when the builder is given none. */
    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);

    private final String id;
    private final String name;
    private final String description;
    private final Severity severity;
    private final List<AlertCondition> conditions;
    private final boolean enabled;
    private final Duration cooldown;
    private final List<String> tags;
    private final Map<String, String> labels;
    private final List<String> actions;
    private final Instant createdAt;
    private final Instant updatedAt;

    private volatile Instant lastTriggered;
    private volatile AlertState state;

    private AlertRule(Builder b, Instant now) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description != null ? b.description : "";
        this.severity = b.severity;
        this.conditions = List.copyOf(b.conditions);
        this.enabled = b.enabled;
        this.cooldown = b.cooldown != null ? b.cooldown : DEFAULT_COOLDOWN;
        this.tags = List.copyOf(b.tags);
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
        this.actions = List.copyOf(b.actions);
        this.createdAt = b.createdAt != null ? b.createdAt : now;
        this.updatedAt = now;
        this.lastTriggered = b.lastTriggered;
        this.state = b.state != null ? b.state : AlertState.PENDING;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-populated with this rule's configuration and
     * lifecycle fields. Building it keeps {@code createdAt} and refreshes
     * {@code updatedAt}.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .id(id)
                .name(name)
                .description(description)
                .severity(severity)
                .conditions(conditions)
                .enabled(enabled)
                .cooldown(cooldown)
                .tags(tags)
                .labels(labels)
                .actions(actions)
                .state(state);
        b.createdAt = createdAt;
        b.lastTriggered = lastTriggered;
        return b;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Record a trigger: the rule becomes {@link AlertState#ACTIVE}.
     *
     * @param at trigger instant
     */
    public void markTriggered(Instant at) {
        this.lastTriggered = Objects.requireNonNull(at, "trigger instant must not be null");
        this.state = AlertState.ACTIVE;
    }

    public void setState(AlertState state) {
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertRule}.
     *
     * <p>
     * {@link #build()} collects every missing required field and throws a
     * single {@link RuleValidationException}.
     * </p>
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity;
        private final List<AlertCondition> conditions = new ArrayList<>();
        private boolean enabled = true;
        private Duration cooldown = DEFAULT_COOLDOWN;
        private final List<String> tags = new ArrayList<>();
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final List<String> actions = new ArrayList<>();
        private AlertState state = AlertState.PENDING;
        private Instant createdAt;
        private Instant lastTriggered;
        private Clock clock = Clock.systemUTC();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /** Append one condition. */
        public Builder condition(AlertCondition condition) {
            this.conditions.add(Objects.requireNonNull(condition, "condition must not be null"));
            return this;
        }

        /** Replace all conditions. */
        public Builder conditions(Collection<AlertCondition> conditions) {
            this.conditions.clear();
            if (conditions != null) {
                conditions.forEach(this::condition);
            }
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            if (cooldown != null && cooldown.isNegative()) {
                throw new IllegalArgumentException("cooldown must not be negative, got: " + cooldown);
            }
            this.cooldown = cooldown;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag must not be null"));
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            if (tags != null) {
                tags.forEach(this::tag);
            }
            return this;
        }

        public Builder label(String key, String value) {
            this.labels.put(Objects.requireNonNull(key, "label key must not be null"),
                    Objects.requireNonNull(value, "label value must not be null"));
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels.clear();
            if (labels != null) {
                labels.forEach(this::label);
            }
            return this;
        }

        /** Append one notification channel id. */
        public Builder action(String channelId) {
            this.actions.add(Objects.requireNonNull(channelId, "channel id must not be null"));
            return this;
        }

        public Builder actions(Collection<String> channelIds) {
            this.actions.clear();
            if (channelIds != null) {
                channelIds.forEach(this::action);
            }
            return this;
        }

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        /** Clock used for {@code createdAt} / {@code updatedAt}. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Build the rule.
         *
         * @return a new {@link AlertRule}
         * @throws RuleValidationException if {@code id}, {@code name},
         *                                 {@code severity} or conditions are
         *                                 missing
         */
        public AlertRule build() {
            List<String> errors = new ArrayList<>();
            if (id == null || id.isBlank()) {
                errors.add("Rule 'id' is required");
            }
            if (name == null || name.isBlank()) {
                errors.add("Rule 'name' is required");
            }
            if (severity == null) {
                errors.add("Rule 'severity' is required");
            }
            if (conditions.isEmpty()) {
                errors.add("Rule requires at least one condition");
            }
            if (!errors.isEmpty()) {
                throw new RuleValidationException(errors);
            }
            return new AlertRule(this, clock.instant());
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return unmodifiable, ordered list of conditions
     */
    public List<AlertCondition> getConditions() {
        return conditions;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public List<String> getTags() {
        return tags;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    /**
     * @return channel ids to notify, in notification order
     */
    public List<String> getActions() {
        return actions;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * @return instant of the last trigger, or {@code null} if never triggered
     */
    public Instant getLastTriggered() {
        return lastTriggered;
    }

    public AlertState getState() {
        return state;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return id.equals(that.id) && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, updatedAt);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", severity=" + severity +
                ", conditions=" + conditions +
                ", enabled=" + enabled +
                ", cooldown=" + cooldown +
                ", actions=" + actions +
                ", state=" + state +
                '}';
    }
}
