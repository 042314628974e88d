package com.alertsentinel.core.manager;

import com.alertsentinel.core.config.AlertConfig;
import com.alertsentinel.core.config.RulesLoader;
import com.alertsentinel.core.detection.Anomaly;
import com.alertsentinel.core.detection.AnomalyType;
import com.alertsentinel.core.evaluation.ChannelDelivery;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.evaluation.EvaluationResult;
import com.alertsentinel.core.model.AlertCondition;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.Severity;
import com.alertsentinel.core.notification.ChannelSupport;
import com.alertsentinel.core.notification.ChannelType;
import com.alertsentinel.core.notification.LocalHttpEndpoint;
import com.alertsentinel.core.notification.NotificationChannel;
import com.alertsentinel.core.notification.NotificationConfig;
import com.alertsentinel.core.notification.UnsupportedChannelTypeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AlertManager}.
 */
class AlertManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private AlertManager manager;
    private LocalHttpEndpoint endpoint;

    @BeforeEach
    void setUp() throws Exception {
        manager = new AlertManager();
        endpoint = LocalHttpEndpoint.start();
    }

    @AfterEach
    void tearDown() {
        manager.close();
        endpoint.close();
    }

    @Test
    @DisplayName("Should trigger a zero-duration rule and mark it active")
    void shouldTriggerRule() {
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).build());

        List<EvaluationResult> results = manager.evaluate(cpu(T0, 85));

        assertThat(results).singleElement().satisfies(r -> assertThat(r.isTriggered()).isTrue());
        AlertRule rule = manager.getRule("cpu-high").orElseThrow();
        assertThat(rule.getState()).isEqualTo(AlertState.ACTIVE);
        assertThat(rule.getLastTriggered()).isEqualTo(T0);
        assertThat(manager.getHistory()).singleElement().satisfies(entry -> {
            assertThat(entry.getRuleId()).isEqualTo("cpu-high");
            assertThat(entry.isTriggered()).isTrue();
            assertThat(entry.getMessage()).isEqualTo("Alert 'High CPU' triggered: cpu > 80 (actual: 85.00)");
        });
    }

    @Test
    @DisplayName("Should suppress re-triggering until the cooldown has elapsed")
    void shouldRespectCooldown() {
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).cooldown(Duration.ofMillis(5_000)).build());

        assertThat(manager.evaluate(cpu(T0, 90)).get(0).isTriggered()).isTrue();
        assertThat(manager.evaluate(cpu(T0.plusMillis(3_000), 90)))
                .as("rule in cooldown is skipped entirely")
                .isEmpty();
        assertThat(manager.evaluate(cpu(T0.plusMillis(4_999), 90)))
                .as("one millisecond before the cooldown ends")
                .isEmpty();
        assertThat(manager.getHistory()).hasSize(1);

        assertThat(manager.evaluate(cpu(T0.plusMillis(5_000), 90)).get(0).isTriggered())
                .as("cooldown ends exactly at lastTriggered + cooldown")
                .isTrue();

        assertThat(manager.getHistory()).hasSize(2);
        assertThat(manager.getRule("cpu-high").orElseThrow().getLastTriggered()).isEqualTo(T0.plusMillis(5_000));
        assertThat(manager.evaluate(cpu(T0.plusMillis(9_999), 90))).isEmpty();
        assertThat(manager.evaluate(cpu(T0.plusMillis(10_000), 90)).get(0).isTriggered()).isTrue();
    }

    @Test
    @DisplayName("Should record per-channel outcomes for mixed webhook and email delivery")
    void shouldRecordMixedDeliveries() {
        manager.addChannel(NotificationConfig.builder()
                .id("ops-webhook").type(ChannelType.WEBHOOK).config("url", endpoint.url()).build());
        manager.addChannel(NotificationConfig.builder()
                .id("oncall-email").type(ChannelType.EMAIL).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).action("ops-webhook").action("oncall-email").build());

        EvaluationResult result = manager.evaluate(cpu(T0, 95)).get(0);

        assertThat(result.getDeliveries()).extracting(ChannelDelivery::getChannelId)
                .containsExactly("ops-webhook", "oncall-email");
        assertThat(result.isFullyDelivered()).isFalse();

        List<AlertHistoryEntry> history = manager.getHistory();
        assertThat(history).hasSize(1);
        List<ChannelDelivery> deliveries = history.get(0).getDeliveries();
        assertThat(deliveries.get(0).isSuccess()).isTrue();
        assertThat(deliveries.get(1).isSuccess()).isFalse();
        assertThat(deliveries.get(1).getError()).isEqualTo("Email recipient not configured");
        assertThat(endpoint.bodies()).hasSize(1);
    }

    @Test
    @DisplayName("Should skip missing and disabled channels silently")
    void shouldSkipMissingAndDisabledChannels() {
        manager.addChannel(NotificationConfig.builder()
                .id("muted").type(ChannelType.WEBHOOK).enabled(false).config("url", endpoint.url()).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).action("muted").action("ghost").build());

        EvaluationResult result = manager.evaluate(cpu(T0, 95)).get(0);

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getDeliveries()).isEmpty();
        assertThat(manager.getHistory()).singleElement()
                .satisfies(e -> assertThat(e.getDeliveries()).isEmpty());
        assertThat(endpoint.bodies()).isEmpty();
    }

    @Test
    @DisplayName("Should record a slow channel as a timed-out delivery")
    void shouldTimeOutSlowChannel() {
        manager.close();
        manager = new AlertManager(AlertConfig.builder().notificationTimeout(Duration.ofMillis(200)).build(),
                ChannelSupport.defaults());
        endpoint.respondAfter(Duration.ofSeconds(2));
        manager.addChannel(NotificationConfig.builder()
                .id("slow").type(ChannelType.WEBHOOK).config("url", endpoint.url()).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).action("slow").build());

        EvaluationResult result = manager.evaluate(cpu(T0, 95)).get(0);

        assertThat(result.getDeliveries()).singleElement().satisfies(d -> {
            assertThat(d.isSuccess()).isFalse();
            assertThat(d.getError()).contains("timed out");
        });
    }

    @Test
    @DisplayName("Should serve other callers while a slow channel is being awaited")
    void shouldNotBlockCallersDuringDelivery() throws Exception {
        manager.close();
        manager = new AlertManager(AlertConfig.builder().notificationTimeout(Duration.ofSeconds(10)).build(),
                ChannelSupport.defaults());
        endpoint.respondAfter(Duration.ofSeconds(2));
        manager.addChannel(NotificationConfig.builder()
                .id("slow").type(ChannelType.WEBHOOK).config("url", endpoint.url()).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).action("slow").build());

        CompletableFuture<List<EvaluationResult>> evaluation =
                CompletableFuture.supplyAsync(() -> manager.evaluate(cpu(T0, 95)));
        long deadline = System.currentTimeMillis() + 5_000;
        while (endpoint.bodies().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(endpoint.bodies()).as("request reached the slow endpoint").hasSize(1);

        CompletableFuture<AlertStats> stats = CompletableFuture.supplyAsync(() -> {
            manager.addRule(cpuRule("other", Duration.ZERO).build());
            return manager.getStats();
        });
        assertThat(stats.get(1, TimeUnit.SECONDS).getTotalRules()).isEqualTo(2);
        assertThat(evaluation).isNotDone();

        List<EvaluationResult> results = evaluation.get(10, TimeUnit.SECONDS);
        assertThat(results.get(0).isFullyDelivered()).isTrue();
        assertThat(manager.getHistory()).singleElement()
                .satisfies(e -> assertThat(e.getDeliveries()).singleElement()
                        .satisfies(d -> assertThat(d.isSuccess()).isTrue()));
    }

    @Test
    @DisplayName("Should bound history and evict the oldest entries first")
    void shouldBoundHistory() {
        manager.close();
        manager = new AlertManager(AlertConfig.builder().maxHistorySize(3).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).cooldown(Duration.ZERO).build());

        for (int i = 0; i < 5; i++) {
            manager.evaluate(cpu(T0.plusSeconds(i), 90));
        }

        List<AlertHistoryEntry> history = manager.getHistory();
        assertThat(history).extracting(AlertHistoryEntry::getTimestamp)
                .containsExactly(T0.plusSeconds(4), T0.plusSeconds(3), T0.plusSeconds(2));
        assertThat(manager.getHistory(1)).extracting(AlertHistoryEntry::getTimestamp)
                .containsExactly(T0.plusSeconds(4));
    }

    @Test
    @DisplayName("Should filter history by rule, most recent first")
    void shouldFilterHistoryByRule() {
        manager.addRule(cpuRule("cpu-a", Duration.ZERO).cooldown(Duration.ZERO).build());
        manager.addRule(cpuRule("cpu-b", Duration.ZERO).cooldown(Duration.ZERO).severity(Severity.INFO).build());
        manager.evaluate(cpu(T0, 90));
        manager.evaluate(cpu(T0.plusSeconds(1), 90));

        assertThat(manager.getHistoryForRule("cpu-b")).hasSize(2)
                .extracting(AlertHistoryEntry::getTimestamp)
                .containsExactly(T0.plusSeconds(1), T0);
        assertThat(manager.getHistoryForRule("cpu-b", 1)).hasSize(1);
        assertThat(manager.getHistoryForRule("unknown")).isEmpty();

        manager.clearHistory();
        assertThat(manager.getHistory()).isEmpty();
    }

    @Test
    @DisplayName("Should purge condition state and cooldown when a rule is removed")
    void shouldPurgeStateOnRemove() {
        manager.addRule(cpuRule("slow", Duration.ofSeconds(10)).build());
        manager.evaluate(cpu(T0, 90));

        assertThat(manager.removeRule("slow")).isTrue();
        manager.addRule(cpuRule("slow", Duration.ofSeconds(10)).build());

        assertThat(manager.evaluate(cpu(T0.plusSeconds(10), 90)).get(0).isTriggered())
                .as("duration window started over after removal")
                .isFalse();

        manager.addRule(cpuRule("fast", Duration.ZERO).build());
        manager.evaluate(cpu(T0.plusSeconds(11), 90));
        manager.removeRule("fast");
        manager.addRule(cpuRule("fast", Duration.ZERO).build());
        assertThat(manager.evaluate(cpu(T0.plusSeconds(12), 90)))
                .filteredOn(r -> r.getRuleId().equals("fast"))
                .singleElement()
                .satisfies(r -> assertThat(r.isTriggered()).as("cooldown purged").isTrue());
    }

    @Test
    @DisplayName("Should update a rule and refresh updatedAt")
    void shouldUpdateRule() {
        AlertRule original = cpuRule("cpu-high", Duration.ZERO).build();
        manager.addRule(original);

        AlertRule updated = manager.updateRule("cpu-high", b -> b.name("CPU saturated").enabled(false));

        assertThat(updated.getName()).isEqualTo("CPU saturated");
        assertThat(updated.isEnabled()).isFalse();
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(original.getUpdatedAt());
        assertThat(updated.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(manager.getRule("cpu-high")).contains(updated);
        assertThat(manager.evaluate(cpu(T0, 99))).as("disabled rule is not evaluated").isEmpty();
    }

    @Test
    @DisplayName("Should fail to update, resolve or silence an unknown rule")
    void shouldFailForUnknownRule() {
        assertThatThrownBy(() -> manager.updateRule("nope", b -> b.name("x")))
                .isInstanceOf(RuleNotFoundException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> manager.resolveRule("nope")).isInstanceOf(RuleNotFoundException.class);
        assertThatThrownBy(() -> manager.silenceRule("nope")).isInstanceOf(RuleNotFoundException.class);
    }

    @Test
    @DisplayName("Should skip silenced rules until they are resolved")
    void shouldSilenceAndResolve() {
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).cooldown(Duration.ZERO).build());

        manager.silenceRule("cpu-high");
        assertThat(manager.evaluate(cpu(T0, 95))).isEmpty();
        assertThat(manager.getRule("cpu-high").orElseThrow().getState()).isEqualTo(AlertState.SILENCED);

        manager.resolveRule("cpu-high");
        assertThat(manager.getRule("cpu-high").orElseThrow().getState()).isEqualTo(AlertState.RESOLVED);
        assertThat(manager.evaluate(cpu(T0.plusSeconds(1), 95)).get(0).isTriggered()).isTrue();
        assertThat(manager.getRule("cpu-high").orElseThrow().getState()).isEqualTo(AlertState.ACTIVE);
    }

    @Test
    @DisplayName("Should evaluate enabled rules in registration order")
    void shouldEvaluateInRegistrationOrder() {
        manager.addRule(cpuRule("b", Duration.ZERO).build());
        manager.addRule(cpuRule("off", Duration.ZERO).enabled(false).build());
        manager.addRule(cpuRule("a", Duration.ZERO).build());

        assertThat(manager.evaluate(cpu(T0, 10))).extracting(EvaluationResult::getRuleId)
                .containsExactly("b", "a");
        assertThat(manager.getAllRules()).extracting(AlertRule::getId).containsExactly("b", "off", "a");
    }

    @Test
    @DisplayName("Should report stats with registered rules counted by severity")
    void shouldReportStats() {
        manager.addChannel(NotificationConfig.builder().id("log").type(ChannelType.CONSOLE).build());
        manager.addRule(cpuRule("crit", Duration.ZERO).action("log").build());
        manager.addRule(cpuRule("warn", Duration.ZERO).severity(Severity.WARNING).build());
        manager.addRule(cpuRule("off", Duration.ZERO).enabled(false).build());

        AlertStats before = manager.getStats();
        assertThat(before.getTotalAlerts()).isZero();
        assertThat(before.getAlertsBySeverity())
                .as("disabled rules are counted too")
                .containsEntry(Severity.CRITICAL, 2)
                .containsEntry(Severity.WARNING, 1)
                .containsEntry(Severity.INFO, 0);

        manager.evaluate(cpu(T0, 90));
        AlertStats stats = manager.getStats();

        assertThat(stats.getTotalRules()).isEqualTo(3);
        assertThat(stats.getActiveRules()).isEqualTo(2);
        assertThat(stats.getTotalAlerts()).isEqualTo(2);
        assertThat(stats.getChannelCount()).isEqualTo(1);
        assertThat(stats.getAlertsBySeverity()).isEqualTo(before.getAlertsBySeverity());

        manager.removeRule("off");
        assertThat(manager.getStats().getAlertsBySeverity()).containsEntry(Severity.CRITICAL, 1);
    }

    @Test
    @DisplayName("Should return no anomalies when detection is disabled")
    void shouldReturnNoAnomaliesWhenDisabled() {
        for (int i = 0; i < 25; i++) {
            manager.detectAnomalies("latency", 10, T0);
        }

        assertThat(manager.isAnomalyDetectionEnabled()).isFalse();
        assertThat(manager.detectAnomalies("latency", 200, T0)).isEmpty();
    }

    @Test
    @DisplayName("Should delegate to the anomaly detector when enabled")
    void shouldDetectAnomaliesWhenEnabled() {
        manager.close();
        manager = new AlertManager(AlertConfig.builder().enableAnomalyDetection(true).build());
        for (int i = 0; i < 25; i++) {
            manager.detectAnomalies("latency", 10, T0.plusSeconds(i));
        }

        List<Anomaly> anomalies = manager.detectAnomalies("latency", 200, T0.plusSeconds(25));

        assertThat(anomalies).extracting(Anomaly::getType).contains(AnomalyType.SPIKE);
        assertThat(anomalies.get(0).getExpectedValue()).isCloseTo(450.0 / 26, within(1e-9));
    }

    @Test
    @DisplayName("Should reject unsupported channel types when adding a channel")
    void shouldRejectUnsupportedChannel() {
        assertThatThrownBy(() -> manager.addChannel(NotificationConfig.builder().id("x").type("sms").build()))
                .isInstanceOf(UnsupportedChannelTypeException.class);
    }

    @Test
    @DisplayName("Should register channels and rules from a rules file")
    void shouldLoadRulesConfig() {
        manager.load(RulesLoader.fromClasspath("test-rules.yml"));

        assertThat(manager.getAllChannels()).extracting(NotificationChannel::getId).containsExactly("ops-webhook", "oncall");
        assertThat(manager.getAllRules()).extracting(AlertRule::getId).containsExactly("high-cpu", "error-burst");
    }

    @Test
    @DisplayName("Should clear all state on reset")
    void shouldReset() {
        manager.addChannel(NotificationConfig.builder().id("log").type(ChannelType.CONSOLE).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).build());
        manager.evaluate(cpu(T0, 90));

        manager.reset();

        assertThat(manager.getAllRules()).isEmpty();
        assertThat(manager.getAllChannels()).isEmpty();
        assertThat(manager.getHistory()).isEmpty();
        assertThat(manager.getStats().getTotalAlerts()).isZero();
    }

    @Test
    @DisplayName("Should evaluate periodically until stopped")
    void shouldAutoEvaluate() throws Exception {
        manager.close();
        manager = new AlertManager(AlertConfig.builder().evaluationInterval(Duration.ofMillis(50)).build());
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).cooldown(Duration.ZERO).build());

        manager.startAutoEvaluation(() -> cpu(Instant.now(), 99));
        assertThat(manager.isAutoEvaluating()).isTrue();

        long deadline = System.currentTimeMillis() + 5_000;
        while (manager.getHistory().size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        manager.stopAutoEvaluation();

        assertThat(manager.isAutoEvaluating()).isFalse();
        assertThat(manager.getHistory().size()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Should stop auto-evaluation and clear state on dispose")
    void shouldDispose() {
        manager.addRule(cpuRule("cpu-high", Duration.ZERO).build());
        manager.startAutoEvaluation(() -> cpu(Instant.now(), 10));

        manager.dispose();

        assertThat(manager.isAutoEvaluating()).isFalse();
        assertThat(manager.getAllRules()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertRule.Builder cpuRule(String id, Duration duration) {
        return AlertRule.builder()
                .id(id)
                .name("High CPU")
                .severity(Severity.CRITICAL)
                .condition(AlertCondition.builder()
                        .metric("cpu")
                        .operator(ComparisonOperator.GREATER_THAN)
                        .threshold(80)
                        .duration(duration)
                        .build());
    }

    private static EvaluationContext cpu(Instant at, double value) {
        return EvaluationContext.builder().timestamp(at).sample("cpu", value).build();
    }
}
