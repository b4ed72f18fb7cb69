package fr.lapetina.tr064.domain.model;

import java.util.Objects;

/**
 * A single action argument.
 * The data type is not stored here but resolved through the owning
 * service's state-variable table.
 */
public record Argument(
        String name,
        Direction direction,
        String relatedStateVariable
) {
    public Argument {
        Objects.requireNonNull(name, "Argument name is required");
        if (direction == null) {
            direction = Direction.IN;
        }
    }

    public boolean isOut() {
        return direction == Direction.OUT;
    }

    public enum Direction {
        IN,
        OUT;

        /**
         * Parses the descriptor value ("in" / "out"), defaulting to IN.
         */
        public static Direction fromDescriptor(String value) {
            if (value != null && value.trim().equalsIgnoreCase("out")) {
                return OUT;
            }
            return IN;
        }
    }
}
