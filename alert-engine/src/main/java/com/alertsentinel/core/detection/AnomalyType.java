package com.alertsentinel.core.detection;

/**
 * Kinds of statistical anomaly reported by {@link AnomalyDetector}.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Value far above the rolling mean. */
    SPIKE,

    /** Value far below the rolling mean. */
    DROP,

    /** Value far from the rolling mean in either direction. */
    OUTLIER,

    /** Slope sign reversal between the two halves of the window. */
    TREND_CHANGE
}
