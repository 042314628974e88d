package com.alertsentinel.core.detection;

/**
 * Mean, population standard deviation and least-squares slope over a sample
 * array.
 */
final class WindowStatistics {

    private final double mean;
    private final double stdDev;

    private WindowStatistics(double mean, double stdDev) {
        this.mean = mean;
        this.stdDev = stdDev;
    }

    static WindowStatistics of(double[] values) {
        double mean = mean(values, 0, values.length);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return new WindowStatistics(mean, Math.sqrt(sumSquaredDiff / values.length));
    }

    double mean() {
        return mean;
    }

    double stdDev() {
        return stdDev;
    }

    /**
     * Ordinary-least-squares slope of {@code values[from, to)} against the
     * sample index.
     *
     * @return the slope, or {@code 0} for fewer than two samples
     */
    static double slope(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return 0;
        }
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            double y = values[from + i];
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        return (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
