package com.alertsentinel.core.evaluation;

import java.time.Instant;

/**
 * Duration-tracking state for one {@code ruleId:metric} pair.
 */
final class ConditionState {

    private Instant firstMetAt;
    private boolean consecutiveMet;

    /**
     * Record an observation. A false observation clears the window; the
     * first true observation after that opens a new one at {@code now}.
     *
     * @param comparisonMet result of the raw comparison
     * @param now           evaluation instant
     * @return start of the current window, or {@code null} when the
     *         comparison does not hold
     */
    Instant observe(boolean comparisonMet, Instant now) {
        if (!comparisonMet) {
            consecutiveMet = false;
            firstMetAt = null;
            return null;
        }
        if (!consecutiveMet) {
            consecutiveMet = true;
            firstMetAt = now;
        }
        return firstMetAt;
    }

    boolean isConsecutiveMet() {
        return consecutiveMet;
    }

    Instant getFirstMetAt() {
        return firstMetAt;
    }
}
