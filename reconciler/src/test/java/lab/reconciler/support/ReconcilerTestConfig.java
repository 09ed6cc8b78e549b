package lab.reconciler.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

/**
 * Replaces the system clock and the HTTP callback client for integration tests.
 */
@TestConfiguration
public class ReconcilerTestConfig {

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));
    }

    @Bean
    @Primary
    public RecordingWebhookTransport recordingWebhookTransport() {
        return new RecordingWebhookTransport();
    }
}
