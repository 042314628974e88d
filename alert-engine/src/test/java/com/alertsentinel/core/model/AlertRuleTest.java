package com.alertsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link AlertRule} and its builder.
 */
class AlertRuleTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Should apply defaults when only required fields are set")
    void shouldApplyDefaults() {
        AlertRule rule = minimalBuilder().build();

        assertThat(rule.isEnabled()).isTrue();
        assertThat(rule.getCooldown()).isEqualTo(Duration.ofMillis(300_000));
        assertThat(rule.getDescription()).isEmpty();
        assertThat(rule.getTags()).isEmpty();
        assertThat(rule.getLabels()).isEmpty();
        assertThat(rule.getActions()).isEmpty();
        assertThat(rule.getState()).isEqualTo(AlertState.PENDING);
        assertThat(rule.getLastTriggered()).isNull();
        assertThat(rule.getCreatedAt()).isEqualTo(NOW);
        assertThat(rule.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should list every missing required field in one exception")
    void shouldReportAllMissingFields() {
        assertThatThrownBy(() -> AlertRule.builder().build())
                .isInstanceOf(RuleValidationException.class)
                .isInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((RuleValidationException) e).getErrors()).hasSize(4))
                .hasMessageContaining("'id'")
                .hasMessageContaining("'name'")
                .hasMessageContaining("'severity'")
                .hasMessageContaining("at least one condition");
    }

    @Test
    @DisplayName("Should reject a rule without conditions")
    void shouldRejectMissingConditions() {
        assertThatThrownBy(() -> AlertRule.builder()
                .id("r1").name("Rule").severity(Severity.INFO).build())
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("at least one condition");
    }

    @Test
    @DisplayName("Should keep conditions, tags, labels and actions in insertion order")
    void shouldKeepCollectionsInOrder() {
        AlertRule rule = minimalBuilder()
                .condition(AlertCondition.of("mem", ComparisonOperator.GREATER_THAN, 90))
                .tag("infra").tag("cpu")
                .label("team", "platform").label("env", "prod")
                .action("webhook").action("email")
                .build();

        assertThat(rule.getConditions()).extracting(AlertCondition::getMetric).containsExactly("cpu", "mem");
        assertThat(rule.getTags()).containsExactly("infra", "cpu");
        assertThat(rule.getLabels()).containsExactly(
                entry("team", "platform"),
                entry("env", "prod"));
        assertThat(rule.getActions()).containsExactly("webhook", "email");
    }

    @Test
    @DisplayName("Should expose unmodifiable collections")
    void shouldExposeUnmodifiableCollections() {
        AlertRule rule = minimalBuilder().tag("a").build();

        assertThatThrownBy(() -> rule.getTags().add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> rule.getConditions().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject a negative cooldown")
    void shouldRejectNegativeCooldown() {
        assertThatThrownBy(() -> minimalBuilder().cooldown(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should move to ACTIVE and record the trigger time")
    void shouldMarkTriggered() {
        AlertRule rule = minimalBuilder().build();
        Instant at = NOW.plusSeconds(30);

        rule.markTriggered(at);

        assertThat(rule.getState()).isEqualTo(AlertState.ACTIVE);
        assertThat(rule.getLastTriggered()).isEqualTo(at);
    }

    @Test
    @DisplayName("Should copy a rule through toBuilder and refresh updatedAt only")
    void shouldCopyThroughToBuilder() {
        AlertRule original = minimalBuilder().description("cpu hot").tag("infra").build();
        original.markTriggered(NOW.plusSeconds(5));
        Instant later = NOW.plusSeconds(60);

        AlertRule copy = original.toBuilder()
                .name("Renamed")
                .clock(Clock.fixed(later, ZoneOffset.UTC))
                .build();

        assertThat(copy.getId()).isEqualTo(original.getId());
        assertThat(copy.getName()).isEqualTo("Renamed");
        assertThat(copy.getDescription()).isEqualTo("cpu hot");
        assertThat(copy.getTags()).containsExactly("infra");
        assertThat(copy.getState()).isEqualTo(AlertState.ACTIVE);
        assertThat(copy.getLastTriggered()).isEqualTo(NOW.plusSeconds(5));
        assertThat(copy.getCreatedAt()).isEqualTo(NOW);
        assertThat(copy.getUpdatedAt()).isEqualTo(later);
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private static AlertRule.Builder minimalBuilder() {
        return AlertRule.builder()
                .id("high-cpu")
                .name("High CPU")
                .severity(Severity.CRITICAL)
                .condition(AlertCondition.of("cpu", ComparisonOperator.GREATER_THAN, 80))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
