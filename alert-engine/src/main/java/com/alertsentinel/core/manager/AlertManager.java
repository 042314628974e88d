package com.alertsentinel.core.manager;

import com.alertsentinel.core.config.AlertConfig;
import com.alertsentinel.core.config.RulesConfig;
import com.alertsentinel.core.detection.Anomaly;
import com.alertsentinel.core.detection.AnomalyDetector;
import com.alertsentinel.core.evaluation.ChannelDelivery;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.evaluation.EvaluationResult;
import com.alertsentinel.core.evaluation.RuleEvaluator;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.Severity;
import com.alertsentinel.core.notification.ChannelFactory;
import com.alertsentinel.core.notification.ChannelSupport;
import com.alertsentinel.core.notification.NotificationChannel;
import com.alertsentinel.core.notification.NotificationConfig;
import com.alertsentinel.core.notification.NotificationPayload;
import com.alertsentinel.core.notification.NotificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point of the engine: owns the rule registry, the notification
 * channels, cooldowns and the alert history.
 *
 * <h3>Evaluation</h3>
 * <p>
 * {@link #evaluate(EvaluationContext)} walks the enabled rules in
 * registration order. Rules inside their cooldown window, and silenced
 * rules, are skipped entirely. A triggered rule becomes
 * {@link AlertState#ACTIVE}, starts its cooldown at the context timestamp
 * and is sent to each of its action channels. All sends of one pass are
 * started before any is awaited, and each is bounded by
 * {@link AlertConfig#getNotificationTimeout()}.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Channel failures, exceptions and timeouts are recorded as failed
 * {@link ChannelDelivery deliveries}; they never escape {@code evaluate}.
 * An unexpected exception while evaluating one rule is logged and the
 * remaining rules are still evaluated.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Public methods are {@code synchronized} on the instance, so the
 * auto-evaluation thread and callers never interleave state changes.
 * {@code evaluate} holds the lock only while it walks the rules and again
 * while it appends history; it waits for channel deliveries without the
 * lock, so a slow channel never blocks registry or stats calls.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    private static final String DEFAULT_MESSAGE = "Alert triggered";

    private final AlertConfig config;
    private final ChannelSupport channelSupport;
    private final RuleEvaluator evaluator = new RuleEvaluator();
    private final AnomalyDetector anomalyDetector;

    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    private final Map<String, Instant> cooldowns = new HashMap<>();
    private final Deque<AlertHistoryEntry> history = new ArrayDeque<>();

    private EvaluationScheduler scheduler;

    public AlertManager() {
        this(AlertConfig.defaults());
    }

    public AlertManager(AlertConfig config) {
        this(config, ChannelSupport.defaults());
    }

    /**
     * @param config         engine settings
     * @param channelSupport collaborators handed to every channel created by
     *                       {@link #addChannel(NotificationConfig)}
     */
    public AlertManager(AlertConfig config, ChannelSupport channelSupport) {
        this.config = Objects.requireNonNull(config, "AlertConfig must not be null");
        this.channelSupport = Objects.requireNonNull(channelSupport, "ChannelSupport must not be null");
        this.anomalyDetector = config.isEnableAnomalyDetection()
                ? new AnomalyDetector(config.getAnomalyConfig())
                : null;
        LOG.info("AlertManager created: {}", config);
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * Register a rule. A rule with the same id is replaced in place, keeping
     * its registration position.
     */
    public synchronized void addRule(AlertRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        AlertRule previous = rules.put(rule.getId(), rule);
        if (previous == null) {
            LOG.info("Registered rule [{}] '{}' ({})", rule.getId(), rule.getName(), rule.getSeverity().label());
        } else {
            if (!previous.getConditions().equals(rule.getConditions())) {
                evaluator.resetRule(rule.getId());
            }
            LOG.info("Replaced rule [{}]", rule.getId());
        }
    }

    /**
     * Remove a rule together with its condition state and cooldown.
     *
     * @return {@code true} if the rule was registered
     */
    public synchronized boolean removeRule(String ruleId) {
        AlertRule removed = rules.remove(ruleId);
        evaluator.resetRule(ruleId);
        cooldowns.remove(ruleId);
        if (removed != null) {
            LOG.info("Removed rule [{}]", ruleId);
        }
        return removed != null;
    }

    public synchronized Optional<AlertRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    /**
     * @return the registered rules in registration order
     */
    public synchronized List<AlertRule> getAllRules() {
        return List.copyOf(rules.values());
    }

    /**
     * Replace a rule with an edited copy. The updater receives a builder
     * pre-populated from the current rule; the id cannot be changed and
     * {@code updatedAt} is refreshed. If the conditions change, the rule's
     * duration state starts over.
     *
     * @param ruleId  id of the rule to update
     * @param updater edits to apply
     * @return the updated rule
     * @throws RuleNotFoundException if no rule has this id
     */
    public synchronized AlertRule updateRule(String ruleId, Consumer<AlertRule.Builder> updater) {
        Objects.requireNonNull(updater, "updater must not be null");
        AlertRule existing = rules.get(ruleId);
        if (existing == null) {
            throw new RuleNotFoundException(ruleId);
        }
        AlertRule.Builder builder = existing.toBuilder();
        updater.accept(builder);
        AlertRule updated = builder.id(ruleId).build();

        if (!existing.getConditions().equals(updated.getConditions())) {
            evaluator.resetRule(ruleId);
        }
        rules.put(ruleId, updated);
        LOG.info("Updated rule [{}]", ruleId);
        return updated;
    }

    /**
     * Mark a rule {@link AlertState#RESOLVED}. A silenced rule becomes
     * eligible for evaluation again.
     *
     * @throws RuleNotFoundException if no rule has this id
     */
    public synchronized void resolveRule(String ruleId) {
        requireRule(ruleId).setState(AlertState.RESOLVED);
        LOG.info("Rule [{}] resolved", ruleId);
    }

    /**
     * Mark a rule {@link AlertState#SILENCED}. Silenced rules are not
     * evaluated until {@link #resolveRule(String) resolved}.
     *
     * @throws RuleNotFoundException if no rule has this id
     */
    public synchronized void silenceRule(String ruleId) {
        requireRule(ruleId).setState(AlertState.SILENCED);
        LOG.info("Rule [{}] silenced", ruleId);
    }

    // ---------------------------------------------------------------
    // Channels
    // ---------------------------------------------------------------

    /**
     * Create and register a channel. A channel with the same id is replaced.
     *
     * @throws com.alertsentinel.core.notification.UnsupportedChannelTypeException
     *         if the type is not supported
     */
    public synchronized NotificationChannel addChannel(NotificationConfig channelConfig) {
        NotificationChannel channel = ChannelFactory.create(channelConfig, channelSupport);
        channels.put(channel.getId(), channel);
        LOG.info("Registered {} channel [{}]", channel.getType().tag(), channel.getId());
        return channel;
    }

    /**
     * @return {@code true} if the channel was registered
     */
    public synchronized boolean removeChannel(String channelId) {
        boolean removed = channels.remove(channelId) != null;
        if (removed) {
            LOG.info("Removed channel [{}]", channelId);
        }
        return removed;
    }

    public synchronized Optional<NotificationChannel> getChannel(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public synchronized List<NotificationChannel> getAllChannels() {
        return List.copyOf(channels.values());
    }

    /**
     * Register every channel, then every rule, of a loaded rules file.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public synchronized void load(RulesConfig rulesConfig) {
        Objects.requireNonNull(rulesConfig, "RulesConfig must not be null");
        rulesConfig.validate();
        rulesConfig.toNotificationConfigs().forEach(this::addChannel);
        rulesConfig.toRules().forEach(this::addRule);
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate every eligible rule against {@code context} and dispatch
     * notifications for the ones that trigger.
     *
     * @param context metric snapshot
     * @return one result per evaluated rule, in registration order;
     *         triggered results carry their channel deliveries
     */
    public List<EvaluationResult> evaluate(EvaluationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Instant now = context.getTimestamp();

        List<EvaluationResult> results = new ArrayList<>();
        List<PendingDispatch> dispatches = new ArrayList<>();

        synchronized (this) {
            for (AlertRule rule : rules.values()) {
                if (!rule.isEnabled() || rule.getState() == AlertState.SILENCED) {
                    continue;
                }
                Instant cooldownEnd = cooldowns.get(rule.getId());
                if (cooldownEnd != null && now.isBefore(cooldownEnd)) {
                    LOG.debug("Rule [{}] in cooldown until {}", rule.getId(), cooldownEnd);
                    continue;
                }

                EvaluationResult result;
                try {
                    result = evaluator.evaluate(rule, context);
                } catch (RuntimeException e) {
                    LOG.error("Failed to evaluate rule [{}]", rule.getId(), e);
                    continue;
                }

                if (result.isTriggered()) {
                    rule.markTriggered(now);
                    cooldowns.put(rule.getId(), now.plus(rule.getCooldown()));
                    LOG.info("Rule [{}] triggered: {}", rule.getId(), result.getMessage());
                    dispatches.add(new PendingDispatch(results.size(), rule.getId(), rule.getSeverity(),
                            result, dispatch(rule, result)));
                }
                results.add(result);
            }
        }

        List<AlertHistoryEntry> entries = new ArrayList<>(dispatches.size());
        for (PendingDispatch pending : dispatches) {
            List<ChannelDelivery> deliveries = pending.sends.stream()
                    .map(CompletableFuture::join)
                    .toList();
            results.set(pending.index, pending.result.withDeliveries(deliveries));
            entries.add(new AlertHistoryEntry(
                    pending.ruleId,
                    pending.severity,
                    now,
                    true,
                    pending.result.getMessage() != null ? pending.result.getMessage() : DEFAULT_MESSAGE,
                    deliveries));
        }
        if (!entries.isEmpty()) {
            synchronized (this) {
                entries.forEach(this::appendHistory);
            }
        }
        return results;
    }

    /**
     * Feed one observation to the anomaly detector.
     *
     * @return detected anomalies; always empty when anomaly detection is
     *         disabled
     */
    public synchronized List<Anomaly> detectAnomalies(String metric, double value, Instant timestamp) {
        if (anomalyDetector == null) {
            return List.of();
        }
        return anomalyDetector.detect(metric, value, timestamp);
    }

    public boolean isAnomalyDetectionEnabled() {
        return anomalyDetector != null;
    }

    // ---------------------------------------------------------------
    // History and stats
    // ---------------------------------------------------------------

    /**
     * @return all retained history, most recent first
     */
    public synchronized List<AlertHistoryEntry> getHistory() {
        return newestFirst(new ArrayList<>(history), Integer.MAX_VALUE);
    }

    /**
     * @param limit maximum number of entries to return
     * @return up to {@code limit} entries, most recent first
     */
    public synchronized List<AlertHistoryEntry> getHistory(int limit) {
        return newestFirst(new ArrayList<>(history), limit);
    }

    public synchronized List<AlertHistoryEntry> getHistoryForRule(String ruleId) {
        return getHistoryForRule(ruleId, Integer.MAX_VALUE);
    }

    /**
     * @param ruleId rule to filter by
     * @param limit  maximum number of entries to return
     * @return up to {@code limit} entries of that rule, most recent first
     */
    public synchronized List<AlertHistoryEntry> getHistoryForRule(String ruleId, int limit) {
        List<AlertHistoryEntry> matching = new ArrayList<>();
        for (AlertHistoryEntry entry : history) {
            if (entry.getRuleId().equals(ruleId)) {
                matching.add(entry);
            }
        }
        return newestFirst(matching, limit);
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    /**
     * @return rule and channel counts, the number of retained alerts, and
     *         registered rules per severity
     */
    public synchronized AlertStats getStats() {
        int enabled = (int) rules.values().stream().filter(AlertRule::isEnabled).count();
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (AlertRule rule : rules.values()) {
            bySeverity.merge(rule.getSeverity(), 1, Integer::sum);
        }
        return new AlertStats(rules.size(), enabled, history.size(), bySeverity, channels.size());
    }

    // ---------------------------------------------------------------
    // Auto-evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate periodically, at {@link AlertConfig#getEvaluationInterval()},
     * against contexts produced by {@code contextSupplier}. Does nothing if
     * auto-evaluation is already running.
     */
    public synchronized void startAutoEvaluation(Supplier<EvaluationContext> contextSupplier) {
        Objects.requireNonNull(contextSupplier, "contextSupplier must not be null");
        if (scheduler != null) {
            LOG.warn("Auto-evaluation already running");
            return;
        }
        scheduler = new EvaluationScheduler(config.getEvaluationInterval(), () -> {
            EvaluationContext context = contextSupplier.get();
            if (context == null) {
                LOG.warn("Context supplier returned null, skipping evaluation");
                return;
            }
            evaluate(context);
        });
        scheduler.start();
    }

    public synchronized void stopAutoEvaluation() {
        if (scheduler != null) {
            scheduler.stop();
            scheduler = null;
        }
    }

    public synchronized boolean isAutoEvaluating() {
        return scheduler != null;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Clear rules, channels, history, cooldowns, condition state and
     * anomaly windows. Auto-evaluation, if running, keeps running.
     */
    public synchronized void reset() {
        rules.clear();
        channels.clear();
        history.clear();
        cooldowns.clear();
        evaluator.reset();
        if (anomalyDetector != null) {
            anomalyDetector.reset();
        }
        LOG.info("AlertManager reset");
    }

    /**
     * Stop auto-evaluation and clear all state. In-flight notifications are
     * not cancelled.
     */
    public synchronized void dispose() {
        stopAutoEvaluation();
        reset();
    }

    @Override
    public void close() {
        dispose();
    }

    public AlertConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AlertRule requireRule(String ruleId) {
        AlertRule rule = rules.get(ruleId);
        if (rule == null) {
            throw new RuleNotFoundException(ruleId);
        }
        return rule;
    }

    private List<CompletableFuture<ChannelDelivery>> dispatch(AlertRule rule, EvaluationResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("conditions", result.getConditions());
        NotificationPayload payload = new NotificationPayload(rule,
                result.getMessage() != null ? result.getMessage() : DEFAULT_MESSAGE,
                result.getTimestamp(),
                metadata);

        List<CompletableFuture<ChannelDelivery>> sends = new ArrayList<>();
        for (String channelId : rule.getActions()) {
            NotificationChannel channel = channels.get(channelId);
            if (channel == null || !channel.isEnabled()) {
                LOG.debug("Rule [{}]: channel [{}] missing or disabled, skipped", rule.getId(), channelId);
                continue;
            }
            sends.add(send(channel, payload));
        }
        return sends;
    }

    private CompletableFuture<ChannelDelivery> send(NotificationChannel channel, NotificationPayload payload) {
        String channelId = channel.getId();
        CompletableFuture<NotificationResult> future;
        try {
            future = channel.send(payload);
        } catch (RuntimeException e) {
            LOG.warn("Channel [{}] threw while sending: {}", channelId, describe(e));
            return CompletableFuture.completedFuture(ChannelDelivery.failed(channelId, describe(e)));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(ChannelDelivery.failed(channelId, "Channel returned no result"));
        }

        long timeoutMs = config.getNotificationTimeout().toMillis();
        return future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).handle((result, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                String reason = cause instanceof TimeoutException
                        ? "Notification timed out after " + timeoutMs + " ms"
                        : describe(cause);
                LOG.warn("Channel [{}] delivery failed: {}", channelId, reason);
                return ChannelDelivery.failed(channelId, reason);
            }
            if (result == null) {
                return ChannelDelivery.failed(channelId, "Channel returned no result");
            }
            if (!result.isSuccess()) {
                LOG.warn("Channel [{}] delivery failed: {}", channelId, result.getError());
                return ChannelDelivery.failed(channelId, result.getError());
            }
            return ChannelDelivery.succeeded(channelId);
        });
    }

    private void appendHistory(AlertHistoryEntry entry) {
        history.addLast(entry);
        while (history.size() > config.getMaxHistorySize()) {
            history.removeFirst();
        }
    }

    private static List<AlertHistoryEntry> newestFirst(List<AlertHistoryEntry> entries, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        // insertion order reversed first, so equal timestamps stay newest-first under the stable sort
        Collections.reverse(entries);
        entries.sort(Comparator.comparing(AlertHistoryEntry::getTimestamp).reversed());
        return List.copyOf(entries.subList(0, Math.min(limit, entries.size())));
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }

    private static final class PendingDispatch {
        private final int index;
        private final String ruleId;
        private final Severity severity;
        private final EvaluationResult result;
        private final List<CompletableFuture<ChannelDelivery>> sends;

        private PendingDispatch(int index, String ruleId, Severity severity, EvaluationResult result,
                List<CompletableFuture<ChannelDelivery>> sends) {
            this.index = index;
            this.ruleId = ruleId;
            this.severity = severity;
            this.result = result;
            this.sends = sends;
        }
    }
}
