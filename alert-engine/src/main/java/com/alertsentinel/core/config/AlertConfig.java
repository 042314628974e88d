package com.alertsentinel.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable engine-level configuration for an
 * {@link com.alertsentinel.core.manager.AlertManager}.
 *
 * <h3>Defaults</h3>
 * <ul>
 * <li>anomaly detection disabled</li>
 * <li>evaluation interval 10 s</li>
 * <li>history bounded at 1,000 entries</li>
 * <li>notification timeout 30 s</li>
 * </ul>
 *
 * <h3>Environment Variables</h3>
 * <table>
 * <tr>
 * <th>Variable</th>
 * <th>Default</th>
 * </tr>
 * <tr>
 * <td>{@code ALERT_ENABLE_ANOMALY_DETECTION}</td>
 * <td>false</td>
 * </tr>
 * <tr>
 * <td>{@code ALERT_EVALUATION_INTERVAL_MS}</td>
 * <td>10000</td>
 * </tr>
 * <tr>
 * <td>{@code ALERT_MAX_HISTORY_SIZE}</td>
 * <td>1000</td>
 * </tr>
 * <tr>
 * <td>{@code ALERT_NOTIFICATION_TIMEOUT_MS}</td>
 * <td>30000</td>
 * </tr>
 * </table>
 * <p>
 * The nested {@link AnomalyConfig} reads the {@code ANOMALY_*} variables.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfig {

    public static final Duration DEFAULT_EVALUATION_INTERVAL = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_HISTORY_SIZE = 1_000;
    public static final Duration DEFAULT_NOTIFICATION_TIMEOUT = Duration.ofSeconds(30);

    private final boolean enableAnomalyDetection;
    private final AnomalyConfig anomalyConfig;
    private final Duration evaluationInterval;
    private final int maxHistorySize;
    private final Duration notificationTimeout;

    private AlertConfig(Builder b) {
        this.enableAnomalyDetection = b.enableAnomalyDetection;
        this.anomalyConfig = b.anomalyConfig != null ? b.anomalyConfig : AnomalyConfig.defaults();
        this.evaluationInterval = b.evaluationInterval;
        this.maxHistorySize = b.maxHistorySize;
        this.notificationTimeout = b.notificationTimeout;
    }

    public static AlertConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a configuration from environment variables, falling back to
     * defaults for anything unset.
     *
     * @return validated configuration
     * @throws IllegalStateException    if a numeric or boolean variable
     *                                  cannot be parsed
     * @throws IllegalArgumentException if a parsed value is out of range
     */
    public static AlertConfig fromEnvironment() {
        try {
            return builder()
                    .enableAnomalyDetection(
                            EnvironmentVariables.getBoolean("ALERT_ENABLE_ANOMALY_DETECTION", false))
                    .anomalyConfig(AnomalyConfig.fromEnvironment())
                    .evaluationInterval(Duration.ofMillis(Long.parseLong(
                            EnvironmentVariables.get("ALERT_EVALUATION_INTERVAL_MS", "10000"))))
                    .maxHistorySize(Integer.parseInt(
                            EnvironmentVariables.get("ALERT_MAX_HISTORY_SIZE", "1000")))
                    .notificationTimeout(Duration.ofMillis(Long.parseLong(
                            EnvironmentVariables.get("ALERT_NOTIFICATION_TIMEOUT_MS", "30000"))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public Builder toBuilder() {
        return builder()
                .enableAnomalyDetection(enableAnomalyDetection)
                .anomalyConfig(anomalyConfig)
                .evaluationInterval(evaluationInterval)
                .maxHistorySize(maxHistorySize)
                .notificationTimeout(notificationTimeout);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isEnableAnomalyDetection() {
        return enableAnomalyDetection;
    }

    public AnomalyConfig getAnomalyConfig() {
        return anomalyConfig;
    }

    public Duration getEvaluationInterval() {
        return evaluationInterval;
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public Duration getNotificationTimeout() {
        return notificationTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private boolean enableAnomalyDetection;
        private AnomalyConfig anomalyConfig;
        private Duration evaluationInterval = DEFAULT_EVALUATION_INTERVAL;
        private int maxHistorySize = DEFAULT_MAX_HISTORY_SIZE;
        private Duration notificationTimeout = DEFAULT_NOTIFICATION_TIMEOUT;

        public Builder enableAnomalyDetection(boolean v) {
            this.enableAnomalyDetection = v;
            return this;
        }

        public Builder anomalyConfig(AnomalyConfig v) {
            this.anomalyConfig = v;
            return this;
        }

        public Builder evaluationInterval(Duration v) {
            this.evaluationInterval = v;
            return this;
        }

        public Builder maxHistorySize(int v) {
            this.maxHistorySize = v;
            return this;
        }

        public Builder notificationTimeout(Duration v) {
            this.notificationTimeout = v;
            return this;
        }

        /**
         * @return validated configuration
         * @throws IllegalArgumentException if the interval or timeout is not
         *                                  positive, or the history size is
         *                                  below 1
         */
        public AlertConfig build() {
            Objects.requireNonNull(evaluationInterval, "evaluationInterval must not be null");
            Objects.requireNonNull(notificationTimeout, "notificationTimeout must not be null");
            if (evaluationInterval.isZero() || evaluationInterval.isNegative()) {
                throw new IllegalArgumentException("evaluationInterval must be > 0, got: " + evaluationInterval);
            }
            if (maxHistorySize < 1) {
                throw new IllegalArgumentException("maxHistorySize must be >= 1, got: " + maxHistorySize);
            }
            if (notificationTimeout.isZero() || notificationTimeout.isNegative()) {
                throw new IllegalArgumentException("notificationTimeout must be > 0, got: " + notificationTimeout);
            }
            return new AlertConfig(this);
        }
    }

    @Override
    public String toString() {
        return "AlertConfig{" +
                "enableAnomalyDetection=" + enableAnomalyDetection +
                ", anomalyConfig=" + anomalyConfig +
                ", evaluationInterval=" + evaluationInterval +
                ", maxHistorySize=" + maxHistorySize +
                ", notificationTimeout=" + notificationTimeout +
                '}';
    }
}
