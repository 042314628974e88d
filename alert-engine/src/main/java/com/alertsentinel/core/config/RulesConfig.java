package com.alertsentinel.core.config;

import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.notification.NotificationConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * channels:
 *   - id: ops-webhook
 *     type: webhook
 *     config:
 *       url: https://hooks.example.com/alerts
 * rules:
 *   - id: high-cpu
 *     name: High CPU
 *     severity: critical
 *     cooldownMs: 60000
 *     actions: [ops-webhook]
 *     conditions:
 *       - metric: cpu
 *         operator: "&gt;"
 *         threshold: 80
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every entry is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<ChannelDefinition> channels = new ArrayList<>();
    private List<RuleDefinition> rules = new ArrayList<>();

    /**
     * @return unmodifiable list of channel definitions
     */
    public List<ChannelDefinition> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<ChannelDefinition> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of rule definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every channel and rule, plus id uniqueness within each list.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        Set<String> channelIds = new HashSet<>();
        for (int i = 0; i < channels.size(); i++) {
            ChannelDefinition channel = channels.get(i);
            if (channel == null) {
                errors.add("Channel at index " + i + " is empty");
                continue;
            }
            try {
                channel.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (channel.getId() != null && !channelIds.add(channel.getId())) {
                errors.add("Duplicate channel id '" + channel.getId() + "'");
            }
        }

        Set<String> ruleIds = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is empty");
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getId() != null && !ruleIds.add(rule.getId())) {
                errors.add("Duplicate rule id '" + rule.getId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return the channel configs, in file order
     */
    public List<NotificationConfig> toNotificationConfigs() {
        return channels.stream().map(ChannelDefinition::toNotificationConfig).toList();
    }

    /**
     * @return the alert rules, in file order
     */
    public List<AlertRule> toRules() {
        return rules.stream().map(RuleDefinition::toRule).toList();
    }

    @Override
    public String toString() {
        return "RulesConfig{channels=" + channels + ", rules=" + rules + '}';
    }
}
