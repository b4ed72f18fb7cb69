package fr.lapetina.tr064.monitor;

import java.util.Locale;

/**
 * What the reader does with a line when the consumer queue is full.
 */
public enum QueueFullPolicy {
    /** Discard the line and keep reading. */
    DROP,
    /** Wait for free space, giving up only when the monitor is stopped. */
    BLOCK;

    /**
     * Parses a policy name, case-insensitive. Null means {@link #DROP}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static QueueFullPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return DROP;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "drop" -> DROP;
            case "block" -> BLOCK;
            default -> throw new IllegalArgumentException("Unknown queue full policy: " + name);
        };
    }
}
