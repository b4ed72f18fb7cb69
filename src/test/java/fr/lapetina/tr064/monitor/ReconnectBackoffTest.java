package fr.lapetina.tr064.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectBackoffTest {

    @Test
    @DisplayName("should grow delays geometrically up to the maximum")
    void shouldGrowDelays() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofMillis(20), 10.0, Duration.ofSeconds(60), 10);

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofMillis(20));
        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofMillis(20000));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.delayFor(9)).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.getMaxRetries()).isEqualTo(10);
    }

    @Test
    @DisplayName("should keep a constant delay with multiplier one")
    void shouldKeepConstantDelay() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofMillis(500), 1.0, Duration.ofSeconds(60), 3);

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofMillis(500));
    }
}
