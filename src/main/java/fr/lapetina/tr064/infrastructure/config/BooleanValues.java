package fr.lapetina.tr064.infrastructure.config;

import java.util.Locale;
import java.util.Set;

/**
 * Lenient boolean parsing for user-facing values ("true"/"on"/"1", "false"/"off"/"0").
 */
public final class BooleanValues {

    private static final Set<String> TRUE_VALUES = Set.of("true", "on", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "off", "0");

    private BooleanValues() {
        // Utility class
    }

    /**
     * Parses the value case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not a known token
     */
    public static boolean parse(String value) {
        if (value != null) {
            String lower = value.trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(lower)) {
                return true;
            }
            if (FALSE_VALUES.contains(lower)) {
                return false;
            }
        }
        throw new IllegalArgumentException("Can't convert '" + value + "' to a boolean");
    }

    /**
     * Same as {@link #parse(String)} but returns {@code defaultValue} for null or unknown tokens.
     */
    public static Boolean parseOrDefault(String value, Boolean defaultValue) {
        try {
            return parse(value);
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
