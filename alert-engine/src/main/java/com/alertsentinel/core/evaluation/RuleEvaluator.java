package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.AlertCondition;
import com.alertsentinel.core.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates the conditions of an {@link AlertRule} against an
 * {@link EvaluationContext}.
 *
 * <h3>Duration tracking</h3>
 * <p>
 * A condition with a non-zero duration must see its comparison hold on
 * every evaluation for at least that long before it counts as met. The
 * evaluator keeps one window per {@code ruleId:metric}; the window opens on
 * the first evaluation where the comparison holds and is discarded on the
 * first evaluation where it does not. No credit is carried across a false
 * observation.
 * </p>
 *
 * <p>
 * A metric that is absent from the context (or has no samples) yields an
 * actual value of {@code 0} and an unmet condition, and leaves the window
 * untouched.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The rule itself is never modified. The condition-state table is the
 * evaluator's only state and is purged per rule with {@link #resetRule}.
 * This class is <strong>not</strong> thread-safe; the owning manager
 * serializes access.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvaluator.class);

    /** ruleId → (metric key → window). */
    private final Map<String, Map<String, ConditionState>> conditionStates = new HashMap<>();

    /**
     * Evaluate every condition of {@code rule}.
     *
     * @param rule    the rule; must not be {@code null}
     * @param context metric snapshot; must not be {@code null}
     * @return the evaluation outcome; {@code triggered} iff the rule has at
     *         least one condition and all of them are met
     */
    public EvaluationResult evaluate(AlertRule rule, EvaluationContext context) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(context, "context must not be null");

        List<ConditionEvaluationResult> results = new ArrayList<>(rule.getConditions().size());
        Map<String, Integer> metricOccurrences = new HashMap<>();
        boolean allMet = true;

        for (AlertCondition condition : rule.getConditions()) {
            int occurrence = metricOccurrences.merge(condition.getMetric(), 1, Integer::sum) - 1;
            String stateKey = occurrence == 0
                    ? condition.getMetric()
                    : condition.getMetric() + "#" + occurrence;

            ConditionEvaluationResult result = evaluateCondition(rule.getId(), stateKey, condition, context);
            results.add(result);
            allMet &= result.isMet();
        }

        boolean triggered = allMet && !results.isEmpty();
        String message = triggered ? buildMessage(rule, results) : null;

        if (triggered) {
            LOG.debug("Rule [{}] conditions met: {}", rule.getId(), message);
        }
        return new EvaluationResult(rule.getId(), triggered, results, context.getTimestamp(), message);
    }

    /**
     * Discard all duration windows of one rule.
     *
     * @param ruleId rule id
     */
    public void resetRule(String ruleId) {
        conditionStates.remove(ruleId);
    }

    /**
     * Discard all duration windows.
     */
    public void reset() {
        conditionStates.clear();
    }

    /**
     * @return number of condition windows currently tracked, across all rules
     */
    public int trackedConditionCount() {
        return conditionStates.values().stream().mapToInt(Map::size).sum();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ConditionEvaluationResult evaluateCondition(String ruleId, String stateKey,
            AlertCondition condition, EvaluationContext context) {
        List<Double> values = context.getValues(condition.getMetric());

        if (values.isEmpty()) {
            LOG.trace("Rule [{}]: metric '{}' has no samples – condition not met", ruleId, condition.getMetric());
            return new ConditionEvaluationResult(condition, 0, false, Duration.ZERO);
        }

        double actual = condition.getAggregation().apply(values);
        boolean comparisonMet = condition.getOperator().test(actual, condition.getThreshold());

        ConditionState state = conditionStates
                .computeIfAbsent(ruleId, k -> new LinkedHashMap<>())
                .computeIfAbsent(stateKey, k -> new ConditionState());

        Instant now = context.getTimestamp();
        Instant windowStart = state.observe(comparisonMet, now);
        if (windowStart == null) {
            return new ConditionEvaluationResult(condition, actual, false, Duration.ZERO);
        }

        Duration elapsed = Duration.between(windowStart, now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        boolean met = elapsed.compareTo(condition.getDuration()) >= 0;
        return new ConditionEvaluationResult(condition, actual, met, elapsed);
    }

    private static String buildMessage(AlertRule rule, List<ConditionEvaluationResult> results) {
        StringBuilder sb = new StringBuilder("Alert '").append(rule.getName()).append("' triggered:");
        for (ConditionEvaluationResult result : results) {
            if (result.isMet()) {
                AlertCondition c = result.getCondition();
                sb.append(' ')
                        .append(c.getMetric()).append(' ')
                        .append(c.getOperator().symbol()).append(' ')
                        .append(formatNumber(c.getThreshold()))
                        .append(String.format(Locale.ROOT, " (actual: %.2f)", result.getActualValue()));
            }
        }
        return sb.toString();
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
