package fr.lapetina.tr064.domain.error;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Error taxonomy for protocol faults reported by the router.
 *
 * <p>Kinds form a shallow hierarchy through {@link #parent()} so callers can
 * catch coarse-grained families, e.g. every argument value problem with
 * {@code e.getKind().isA(ErrorKind.INVALID_ARGUMENT_VALUE)}.
 */
public enum ErrorKind {
    /** Fault code not present in the mapping table */
    UNKNOWN(null, null),

    /** The action is not known by the service */
    INVALID_ACTION("401", null),

    /** Missing or superfluous argument */
    INVALID_ARGUMENT("402", null),

    /** Argument value out of range or malformed */
    INVALID_ARGUMENT_VALUE("600", INVALID_ARGUMENT),

    ARGUMENT_STRING_TOO_SHORT("801", INVALID_ARGUMENT_VALUE),

    ARGUMENT_STRING_TOO_LONG("802", INVALID_ARGUMENT_VALUE),

    INVALID_CHARACTER_IN_ARGUMENT("803", INVALID_ARGUMENT_VALUE),

    /** Unspecified failure inside the device */
    INTERNAL_DEVICE_ERROR("820", null),

    /** The device could not execute the action */
    ACTION_FAILED("501", INTERNAL_DEVICE_ERROR),

    OUT_OF_MEMORY("603", INTERNAL_DEVICE_ERROR),

    /** Authorization failure or wrong security context */
    SECURITY("606", null),

    /** Addressing an entry of an internal array by index failed */
    ARRAY_INDEX_OUT_OF_RANGE("713", null),

    /** Lookup of an id or entry in an internal array failed */
    LOOKUP_FAILED("714", null);

    private static final Map<String, ErrorKind> BY_CODE = Arrays.stream(values())
            .filter(kind -> kind.code != null)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.code, Function.identity()));

    private final String code;
    private final ErrorKind parent;

    ErrorKind(String code, ErrorKind parent) {
        this.code = code;
        this.parent = parent;
    }

    /**
     * Maps a protocol error code to its kind. Unknown or null codes map to {@link #UNKNOWN}.
     */
    public static ErrorKind fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return BY_CODE.getOrDefault(code.trim(), UNKNOWN);
    }

    public String getCode() {
        return code;
    }

    public ErrorKind parent() {
        return parent;
    }

    /**
     * Returns true if this kind is {@code other} or one of its descendants.
     */
    public boolean isA(ErrorKind other) {
        for (ErrorKind kind = this; kind != null; kind = kind.parent) {
            if (kind == other) {
                return true;
            }
        }
        return false;
    }

    public boolean isIndexError() {
        return this == ARRAY_INDEX_OUT_OF_RANGE;
    }

    public boolean isLookupError() {
        return this == LOOKUP_FAILED;
    }
}
