package com.alertsentinel.core.config;

import java.io.Serializable;

/**
 * Immutable tuning parameters for the statistical anomaly detector.
 *
 * <h3>Defaults</h3>
 * <ul>
 * <li>{@code sensitivity} = 0.7 — minimum confidence for z-score anomalies</li>
 * <li>{@code minDataPoints} = 20 — samples needed before any check runs</li>
 * <li>{@code stdDevThreshold} = 3 — the <i>k</i> in mean ± k·σ</li>
 * <li>every check (spike, drop, trend change, outlier) enabled</li>
 * </ul>
 *
 * <p>
 * Use {@link #defaults()}, {@link #fromEnvironment()} or the {@link Builder},
 * which validates ranges at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double sensitivity;
    private final int minDataPoints;
    private final double stdDevThreshold;
    private final boolean enableSpike;
    private final boolean enableDrop;
    private final boolean enableTrendChange;
    private final boolean enableOutlier;

    private AnomalyConfig(Builder b) {
        this.sensitivity = b.sensitivity;
        this.minDataPoints = b.minDataPoints;
        this.stdDevThreshold = b.stdDevThreshold;
        this.enableSpike = b.enableSpike;
        this.enableDrop = b.enableDrop;
        this.enableTrendChange = b.enableTrendChange;
        this.enableOutlier = b.enableOutlier;
    }

    public static AnomalyConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build an {@link AnomalyConfig} from {@code ANOMALY_*} environment
     * variables, falling back to the defaults.
     *
     * @return validated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static AnomalyConfig fromEnvironment() {
        try {
            return builder()
                    .sensitivity(Double.parseDouble(EnvironmentVariables.get("ANOMALY_SENSITIVITY", "0.7")))
                    .minDataPoints(Integer.parseInt(EnvironmentVariables.get("ANOMALY_MIN_DATA_POINTS", "20")))
                    .stdDevThreshold(Double.parseDouble(EnvironmentVariables.get("ANOMALY_STDDEV_THRESHOLD", "3")))
                    .enableSpike(EnvironmentVariables.getBoolean("ANOMALY_ENABLE_SPIKE", true))
                    .enableDrop(EnvironmentVariables.getBoolean("ANOMALY_ENABLE_DROP", true))
                    .enableTrendChange(EnvironmentVariables.getBoolean("ANOMALY_ENABLE_TREND_CHANGE", true))
                    .enableOutlier(EnvironmentVariables.getBoolean("ANOMALY_ENABLE_OUTLIER", true))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return a builder initialised with this configuration's values
     */
    public Builder toBuilder() {
        return builder()
                .sensitivity(sensitivity)
                .minDataPoints(minDataPoints)
                .stdDevThreshold(stdDevThreshold)
                .enableSpike(enableSpike)
                .enableDrop(enableDrop)
                .enableTrendChange(enableTrendChange)
                .enableOutlier(enableOutlier);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getSensitivity() {
        return sensitivity;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public double getStdDevThreshold() {
        return stdDevThreshold;
    }

    public boolean isEnableSpike() {
        return enableSpike;
    }

    public boolean isEnableDrop() {
        return enableDrop;
    }

    public boolean isEnableTrendChange() {
        return enableTrendChange;
    }

    public boolean isEnableOutlier() {
        return enableOutlier;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnomalyConfig}.
     *
     * <p>
     * {@link #build()} checks that {@code sensitivity} lies in [0, 1],
     * {@code minDataPoints} is at least 2 and {@code stdDevThreshold} is
     * positive.
     * </p>
     */
    public static class Builder {
        private double sensitivity = 0.7;
        private int minDataPoints = 20;
        private double stdDevThreshold = 3;
        private boolean enableSpike = true;
        private boolean enableDrop = true;
        private boolean enableTrendChange = true;
        private boolean enableOutlier = true;

        public Builder sensitivity(double v) {
            this.sensitivity = v;
            return this;
        }

        public Builder minDataPoints(int v) {
            this.minDataPoints = v;
            return this;
        }

        public Builder stdDevThreshold(double v) {
            this.stdDevThreshold = v;
            return this;
        }

        public Builder enableSpike(boolean v) {
            this.enableSpike = v;
            return this;
        }

        public Builder enableDrop(boolean v) {
            this.enableDrop = v;
            return this;
        }

        public Builder enableTrendChange(boolean v) {
            this.enableTrendChange = v;
            return this;
        }

        public Builder enableOutlier(boolean v) {
            this.enableOutlier = v;
            return this;
        }

        /**
         * @return a validated {@link AnomalyConfig}
         * @throws IllegalArgumentException if any value is out of range
         */
        public AnomalyConfig build() {
            if (!(sensitivity >= 0 && sensitivity <= 1)) {
                throw new IllegalArgumentException("sensitivity must be in [0, 1], got: " + sensitivity);
            }
            if (minDataPoints < 2) {
                throw new IllegalArgumentException("minDataPoints must be >= 2, got: " + minDataPoints);
            }
            if (!(stdDevThreshold > 0)) {
                throw new IllegalArgumentException("stdDevThreshold must be > 0, got: " + stdDevThreshold);
            }
            return new AnomalyConfig(this);
        }
    }

    @Override
    public String toString() {
        return "AnomalyConfig{" +
                "sensitivity=" + sensitivity +
                ", minDataPoints=" + minDataPoints +
                ", stdDevThreshold=" + stdDevThreshold +
                ", enableSpike=" + enableSpike +
                ", enableDrop=" + enableDrop +
                ", enableTrendChange=" + enableTrendChange +
                ", enableOutlier=" + enableOutlier +
                '}';
    }
}
