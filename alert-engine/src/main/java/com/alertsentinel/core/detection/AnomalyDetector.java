package com.alertsentinel.core.detection;

import com.alertsentinel.core.config.AnomalyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Online statistical anomaly detector.
 *
 * <p>
 * Keeps a sliding window of the last {@value #MAX_WINDOW_SIZE} samples per
 * metric. Each call to {@link #detect} appends the sample and, once the
 * window holds at least {@code minDataPoints} samples, runs the enabled
 * checks against the window's mean and standard deviation (the new sample
 * included):
 * </p>
 * <ul>
 * <li><b>spike</b> — value above mean + k·σ</li>
 * <li><b>drop</b> — value below mean − k·σ</li>
 * <li><b>outlier</b> — |z| above 1.5·k</li>
 * <li><b>trend change</b> — with at least {@value #TREND_MIN_SAMPLES}
 * samples, the least-squares slopes of the two window halves differ by more
 * than {@value #TREND_SLOPE_CHANGE} and have opposite signs</li>
 * </ul>
 * <p>
 * The z-score checks report only when their confidence reaches the
 * configured sensitivity. They are skipped while σ is zero, since every
 * sample in the window, the new one included, is then equal to the mean.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. The alert manager
 * serializes access to its detector.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Maximum samples retained per metric. */
    public static final int MAX_WINDOW_SIZE = 1_000;

    /** Samples required before trend detection runs. */
    static final int TREND_MIN_SAMPLES = 50;

    /** Minimum absolute slope difference for a trend change. */
    static final double TREND_SLOPE_CHANGE = 0.5;

    private final AnomalyConfig config;

    private final Map<String, Deque<Double>> history = new HashMap<>();

    public AnomalyDetector() {
        this(AnomalyConfig.defaults());
    }

    /**
     * @param config detector configuration; must not be {@code null}
     */
    public AnomalyDetector(AnomalyConfig config) {
        this.config = Objects.requireNonNull(config, "AnomalyConfig must not be null");
    }

    /**
     * Record a sample and report any anomalies it exhibits.
     *
     * @param metric    metric name; must not be {@code null}
     * @param value     observed value
     * @param timestamp observation instant; must not be {@code null}
     * @return zero or more anomalies, in the order spike, drop, outlier,
     *         trend change
     */
    public List<Anomaly> detect(String metric, double value, Instant timestamp) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            LOG.debug("Metric [{}]: ignoring non-finite sample {}", metric, value);
            return Collections.emptyList();
        }

        Deque<Double> window = history.computeIfAbsent(metric, k -> new ArrayDeque<>());
        window.addLast(value);
        if (window.size() > MAX_WINDOW_SIZE) {
            window.pollFirst();
        }

        if (window.size() < config.getMinDataPoints()) {
            return Collections.emptyList();
        }

        double[] samples = toArray(window);
        WindowStatistics stats = WindowStatistics.of(samples);
        List<Anomaly> anomalies = new ArrayList<>();

        if (stats.stdDev() > 0) {
            if (config.isEnableSpike()) {
                detectSpike(metric, value, stats, timestamp, anomalies);
            }
            if (config.isEnableDrop()) {
                detectDrop(metric, value, stats, timestamp, anomalies);
            }
            if (config.isEnableOutlier()) {
                detectOutlier(metric, value, stats, timestamp, anomalies);
            }
        }
        if (config.isEnableTrendChange() && samples.length >= TREND_MIN_SAMPLES) {
            detectTrendChange(metric, samples, stats, timestamp, anomalies);
        }

        if (!anomalies.isEmpty()) {
            LOG.debug("Metric [{}] value={} mean={} stddev={} anomalies={}",
                    metric, value, stats.mean(), stats.stdDev(), anomalies.size());
        }
        return anomalies;
    }

    /**
     * Forget the history of one metric.
     *
     * @param metric metric name
     */
    public void resetMetric(String metric) {
        history.remove(metric);
    }

    /**
     * Forget all history.
     */
    public void reset() {
        history.clear();
    }

    /**
     * @param metric metric name
     * @return number of samples currently in the metric's window
     */
    public int sampleCount(String metric) {
        Deque<Double> window = history.get(metric);
        return window == null ? 0 : window.size();
    }

    public AnomalyConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Checks
    // ---------------------------------------------------------------

    private void detectSpike(String metric, double value, WindowStatistics stats, Instant timestamp,
            List<Anomaly> out) {
        double k = config.getStdDevThreshold();
        if (value > stats.mean() + k * stats.stdDev()) {
            double deviation = (value - stats.mean()) / stats.stdDev();
            double confidence = Math.min(deviation / k, 1);
            if (confidence >= config.getSensitivity()) {
                out.add(new Anomaly(AnomalyType.SPIKE, metric, timestamp, value, stats.mean(), deviation,
                        confidence, String.format(Locale.ROOT,
                                "Value %.2f is %.2f standard deviations above mean", value, deviation)));
            }
        }
    }

    private void detectDrop(String metric, double value, WindowStatistics stats, Instant timestamp,
            List<Anomaly> out) {
        double k = config.getStdDevThreshold();
        if (value < stats.mean() - k * stats.stdDev()) {
            double deviation = (stats.mean() - value) / stats.stdDev();
            double confidence = Math.min(deviation / k, 1);
            if (confidence >= config.getSensitivity()) {
                out.add(new Anomaly(AnomalyType.DROP, metric, timestamp, value, stats.mean(), deviation,
                        confidence, String.format(Locale.ROOT,
                                "Value %.2f is %.2f standard deviations below mean", value, deviation)));
            }
        }
    }

    private void detectOutlier(String metric, double value, WindowStatistics stats, Instant timestamp,
            List<Anomaly> out) {
        double k = config.getStdDevThreshold();
        double zScore = Math.abs((value - stats.mean()) / stats.stdDev());
        if (zScore > k * 1.5) {
            double confidence = Math.min(zScore / (k * 2), 1);
            if (confidence >= config.getSensitivity()) {
                out.add(new Anomaly(AnomalyType.OUTLIER, metric, timestamp, value, stats.mean(), zScore,
                        confidence, String.format(Locale.ROOT,
                                "Value %.2f is an outlier with z-score %.2f", value, zScore)));
            }
        }
    }

    private void detectTrendChange(String metric, double[] samples, WindowStatistics stats, Instant timestamp,
            List<Anomaly> out) {
        int mid = samples.length / 2;
        double firstSlope = WindowStatistics.slope(samples, 0, mid);
        double secondSlope = WindowStatistics.slope(samples, mid, samples.length);
        double slopeChange = Math.abs(secondSlope - firstSlope);

        if (slopeChange > TREND_SLOPE_CHANGE && Math.signum(firstSlope) != Math.signum(secondSlope)) {
            double latest = samples[samples.length - 1];
            out.add(new Anomaly(AnomalyType.TREND_CHANGE, metric, timestamp, latest, stats.mean(), slopeChange,
                    config.getSensitivity(), String.format(Locale.ROOT,
                            "Trend changed from %.3f to %.3f", firstSlope, secondSlope)));
        }
    }

    private static double[] toArray(Deque<Double> window) {
        double[] values = new double[window.size()];
        int i = 0;
        for (double v : window) {
            values[i++] = v;
        }
        return values;
    }
}
