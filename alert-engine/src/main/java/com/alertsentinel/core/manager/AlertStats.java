package com.alertsentinel.core.manager;

import com.alertsentinel.core.model.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time counters exposed by {@link AlertManager#getStats()}.
 *
 * @since 1.0.0
 */
public final class AlertStats {

    private final int totalRules;
    private final int activeRules;
    private final int totalAlerts;
    private final Map<Severity, Integer> alertsBySeverity;
    private final int channelCount;

    public AlertStats(int totalRules, int activeRules, int totalAlerts,
            Map<Severity, Integer> alertsBySeverity, int channelCount) {
        this.totalRules = totalRules;
        this.activeRules = activeRules;
        this.totalAlerts = totalAlerts;
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, alertsBySeverity.getOrDefault(severity, 0));
        }
        this.alertsBySeverity = Collections.unmodifiableMap(counts);
        this.channelCount = channelCount;
    }

    public int getTotalRules() {
        return totalRules;
    }

    /** Number of enabled rules. */
    public int getActiveRules() {
        return activeRules;
    }

    /** Number of alerts currently retained in history. */
    public int getTotalAlerts() {
        return totalAlerts;
    }

    /**
     * @return registered rules per severity, disabled rules included;
     *         every severity is present
     */
    public Map<Severity, Integer> getAlertsBySeverity() {
        return alertsBySeverity;
    }

    public int getChannelCount() {
        return channelCount;
    }

    @Override
    public String toString() {
        return "AlertStats{" +
                "totalRules=" + totalRules +
                ", activeRules=" + activeRules +
                ", totalAlerts=" + totalAlerts +
                ", alertsBySeverity=" + alertsBySeverity +
                ", channelCount=" + channelCount +
                '}';
    }
}
