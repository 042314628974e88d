/**
 * Statistical anomaly detection over per-metric sliding windows.
 *
 * <p>
 * {@link com.alertsentinel.core.detection.AnomalyDetector} flags spikes,
 * drops, z-score outliers and trend reversals independently of any fixed
 * threshold rule. Results are returned as
 * {@link com.alertsentinel.core.detection.Anomaly} values.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.detection;
