package com.alertsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertConfig}.
 */
class AlertConfigTest {

    @Test
    @DisplayName("Should use documented defaults")
    void shouldUseDefaults() {
        AlertConfig config = AlertConfig.defaults();

        assertThat(config.isEnableAnomalyDetection()).isFalse();
        assertThat(config.getEvaluationInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getMaxHistorySize()).isEqualTo(1_000);
        assertThat(config.getNotificationTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getAnomalyConfig().getSensitivity()).isEqualTo(0.7);
        assertThat(config.getAnomalyConfig().getMinDataPoints()).isEqualTo(20);
        assertThat(config.getAnomalyConfig().getStdDevThreshold()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should reject non-positive interval, timeout and history size")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> AlertConfig.builder().evaluationInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("evaluationInterval");
        assertThatThrownBy(() -> AlertConfig.builder().notificationTimeout(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("notificationTimeout");
        assertThatThrownBy(() -> AlertConfig.builder().maxHistorySize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxHistorySize");
    }

    @Test
    @DisplayName("Should copy every field through toBuilder")
    void shouldCopyThroughToBuilder() {
        AlertConfig original = AlertConfig.builder()
                .enableAnomalyDetection(true)
                .maxHistorySize(5)
                .anomalyConfig(AnomalyConfig.builder().sensitivity(0.2).build())
                .build();

        AlertConfig copy = original.toBuilder().evaluationInterval(Duration.ofSeconds(1)).build();

        assertThat(copy.isEnableAnomalyDetection()).isTrue();
        assertThat(copy.getMaxHistorySize()).isEqualTo(5);
        assertThat(copy.getAnomalyConfig().getSensitivity()).isEqualTo(0.2);
        assertThat(copy.getEvaluationInterval()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should build a valid configuration from the environment")
    void shouldBuildFromEnvironment() {
        AlertConfig config = AlertConfig.fromEnvironment();

        assertThat(config).isNotNull();
        assertThat(config.getMaxHistorySize()).isPositive();
        assertThat(config.getAnomalyConfig()).isNotNull();
    }
}
