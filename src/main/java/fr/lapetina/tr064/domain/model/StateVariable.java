package fr.lapetina.tr064.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Type definition shared by one or more arguments of a service.
 */
public record StateVariable(
        String name,
        String dataType,
        String defaultValue,
        List<String> allowedValues,
        ValueRange allowedValueRange,
        boolean sendEvents
) {
    public StateVariable {
        Objects.requireNonNull(name, "State variable name is required");
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
    }

    public static StateVariable of(String name, String dataType) {
        return new StateVariable(name, dataType, null, List.of(), null, false);
    }
}
