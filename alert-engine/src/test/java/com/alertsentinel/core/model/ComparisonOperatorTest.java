package com.alertsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ComparisonOperator}, {@link Aggregation} and
 * {@link AlertCondition}.
 */
class ComparisonOperatorTest {

    @Test
    @DisplayName("Should compare values according to each operator")
    void shouldCompare() {
        assertThat(ComparisonOperator.GREATER_THAN.test(81, 80)).isTrue();
        assertThat(ComparisonOperator.GREATER_THAN.test(80, 80)).isFalse();
        assertThat(ComparisonOperator.GREATER_THAN_OR_EQUAL.test(80, 80)).isTrue();
        assertThat(ComparisonOperator.LESS_THAN.test(79, 80)).isTrue();
        assertThat(ComparisonOperator.LESS_THAN_OR_EQUAL.test(81, 80)).isFalse();
        assertThat(ComparisonOperator.EQUAL.test(80, 80)).isTrue();
        assertThat(ComparisonOperator.NOT_EQUAL.test(80, 80)).isFalse();
    }

    @Test
    @DisplayName("Should parse operator symbols")
    void shouldParseSymbols() {
        assertThat(ComparisonOperator.fromSymbol(">=")).isEqualTo(ComparisonOperator.GREATER_THAN_OR_EQUAL);
        assertThat(ComparisonOperator.fromSymbol(" != ")).isEqualTo(ComparisonOperator.NOT_EQUAL);
        assertThat(ComparisonOperator.fromSymbol("==")).isEqualTo(ComparisonOperator.EQUAL);
        assertThat(ComparisonOperator.LESS_THAN.symbol()).isEqualTo("<");
    }

    @Test
    @DisplayName("Should reject unknown operator symbols")
    void shouldRejectUnknownSymbol() {
        assertThatThrownBy(() -> ComparisonOperator.fromSymbol("=>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown comparison operator");
    }

    @Test
    @DisplayName("Should aggregate sample series")
    void shouldAggregate() {
        List<Double> values = List.of(2.0, 4.0, 9.0);

        assertThat(Aggregation.AVERAGE.apply(values)).isEqualTo(5.0);
        assertThat(Aggregation.SUM.apply(values)).isEqualTo(15.0);
        assertThat(Aggregation.MIN.apply(values)).isEqualTo(2.0);
        assertThat(Aggregation.MAX.apply(values)).isEqualTo(9.0);
        assertThat(Aggregation.COUNT.apply(values)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should aggregate an empty series to zero")
    void shouldAggregateEmptyToZero() {
        for (Aggregation aggregation : Aggregation.values()) {
            assertThat(aggregation.apply(List.of())).isZero();
        }
    }

    @Test
    @DisplayName("Should parse aggregation names case-insensitively")
    void shouldParseAggregations() {
        assertThat(Aggregation.fromString("average")).isEqualTo(Aggregation.AVERAGE);
        assertThat(Aggregation.fromString("avg")).isEqualTo(Aggregation.AVERAGE);
        assertThat(Aggregation.fromString("Max")).isEqualTo(Aggregation.MAX);
        assertThatThrownBy(() -> Aggregation.fromString("median"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should default condition duration and aggregation")
    void shouldDefaultConditionFields() {
        AlertCondition condition = AlertCondition.of("cpu", ComparisonOperator.GREATER_THAN, 80);

        assertThat(condition.getDuration()).isEqualTo(Duration.ZERO);
        assertThat(condition.getAggregation()).isEqualTo(Aggregation.AVERAGE);
    }

    @Test
    @DisplayName("Should reject a condition with a blank metric or negative duration")
    void shouldRejectInvalidCondition() {
        assertThatThrownBy(() -> AlertCondition.of(" ", ComparisonOperator.GREATER_THAN, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AlertCondition.builder()
                .metric("cpu").operator(">").threshold(1).duration(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse severities case-insensitively")
    void shouldParseSeverity() {
        assertThat(Severity.fromString("Critical")).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.WARNING.label()).isEqualTo("warning");
        assertThatThrownBy(() -> Severity.fromString("urgent"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
