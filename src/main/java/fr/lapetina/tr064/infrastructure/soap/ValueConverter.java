package fr.lapetina.tr064.infrastructure.soap;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Converts response text to Java values according to the argument's data type tag.
 *
 * Conversion is lenient: a value that does not match its declared type is
 * returned as the raw text.
 */
public final class ValueConverter {

    private static final Set<String> INTEGER_TYPES = Set.of(
            "i1", "i2", "i4", "i8", "ui1", "ui2", "ui4", "ui8", "int");

    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private ValueConverter() {
    }

    /**
     * @param dataType data type tag, case-insensitive; null means plain text
     * @param text     the element text
     * @return a {@link Long}, {@link Boolean}, {@link LocalDateTime} or {@link String}
     */
    public static Object convert(String dataType, String text) {
        if (dataType == null || text == null) {
            return text;
        }
        String type = dataType.trim().toLowerCase(Locale.ROOT);

        if (INTEGER_TYPES.contains(type)) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return text;
            }
        }
        return switch (type) {
            case "boolean" -> toBoolean(text);
            case "datetime" -> toDateTime(text);
            case "uuid" -> text.substring(text.lastIndexOf(':') + 1);
            default -> text;
        };
    }

    private static Object toBoolean(String text) {
        return switch (text.trim()) {
            case "1" -> Boolean.TRUE;
            case "0" -> Boolean.FALSE;
            default -> text;
        };
    }

    private static Object toDateTime(String text) {
        try {
            return LocalDateTime.parse(text.trim(), DATETIME);
        } catch (DateTimeParseException e) {
            return text;
        }
    }
}
