package fr.lapetina.tr064.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A remote action with its ordered argument list.
 * An empty argument list is valid.
 */
public record Action(
        String name,
        List<Argument> arguments
) {
    public Action {
        Objects.requireNonNull(name, "Action name is required");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public List<Argument> inArguments() {
        return arguments.stream()
                .filter(argument -> !argument.isOut())
                .toList();
    }

    public List<Argument> outArguments() {
        return arguments.stream()
                .filter(Argument::isOut)
                .toList();
    }
}
