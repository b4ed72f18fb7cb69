package fr.lapetina.tr064.monitor;

import java.time.Duration;

/**
 * Geometric reconnect delays: initial, initial * multiplier, ... capped at the maximum.
 */
final class ReconnectBackoff {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final int maxRetries;

    ReconnectBackoff(Duration initialDelay, double multiplier, Duration maxDelay, int maxRetries) {
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.maxRetries = maxRetries;
    }

    /**
     * Delay before the given attempt, counted from 0.
     */
    Duration delayFor(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    int getMaxRetries() {
        return maxRetries;
    }
}
