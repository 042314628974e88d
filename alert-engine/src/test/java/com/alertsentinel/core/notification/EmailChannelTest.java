package com.alertsentinel.core.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EmailChannel}.
 */
class EmailChannelTest {

    private final List<EmailMessage> sent = new CopyOnWriteArrayList<>();

    @Test
    @DisplayName("Should hand a rendered message to the mail transport")
    void shouldSendThroughTransport() throws Exception {
        NotificationChannel channel = emailChannel("oncall@example.com, sre@example.com", sent::add);

        NotificationResult result = channel.send(HttpChannelTest.payload()).get();

        assertThat(result.isSuccess()).isTrue();
        assertThat(sent).singleElement().satisfies(message -> {
            assertThat(message.getTo()).containsExactly("oncall@example.com", "sre@example.com");
            assertThat(message.getFrom()).isEqualTo("alerts@example.com");
            assertThat(message.getSubject()).isEqualTo("[Alert] CRITICAL: High CPU");
            assertThat(message.getBody()).contains("Alert 'High CPU' triggered").contains("high-cpu");
        });
    }

    @Test
    @DisplayName("Should fail without sending when no recipient is configured")
    void shouldFailOnMissingRecipient() throws Exception {
        NotificationChannel channel = emailChannel(null, sent::add);

        NotificationResult result = channel.send(HttpChannelTest.payload()).get();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Email recipient not configured");
        assertThat(sent).isEmpty();
    }

    @Test
    @DisplayName("Should turn a transport error into a failed result")
    void shouldFailOnTransportError() throws Exception {
        NotificationChannel channel = emailChannel("oncall@example.com", message -> {
            throw new IOException("SMTP connection refused");
        });

        NotificationResult result = channel.send(HttpChannelTest.payload()).get();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("SMTP connection refused");
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private static NotificationChannel emailChannel(String to, MailTransport transport) {
        NotificationConfig.Builder config = NotificationConfig.builder()
                .id("email")
                .type(ChannelType.EMAIL)
                .config("from", "alerts@example.com");
        if (to != null) {
            config.config("to", to);
        }
        return ChannelFactory.create(config.build(), ChannelSupport.builder().mailTransport(transport).build());
    }
}
