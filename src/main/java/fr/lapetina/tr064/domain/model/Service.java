package fr.lapetina.tr064.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A service advertised by a device descriptor.
 *
 * <p>Actions and state variables come from the service's own action-schema
 * document. A service whose schema could not be loaded has empty tables.
 * Both maps keep document order.
 */
public record Service(
        String serviceType,
        String serviceId,
        String controlUrl,
        String eventSubUrl,
        String scpdUrl,
        Map<String, Action> actions,
        Map<String, StateVariable> stateVariables
) {
    public Service {
        actions = actions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(actions))
                : Map.of();
        stateVariables = stateVariables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stateVariables))
                : Map.of();
    }

    /**
     * Returns the trailing colon segment of the service id,
     * e.g. "WANIPConn1" for "urn:WANIPConnection-com:serviceId:WANIPConn1".
     */
    public String name() {
        if (serviceId == null) {
            return null;
        }
        int index = serviceId.lastIndexOf(':');
        return index < 0 ? serviceId : serviceId.substring(index + 1);
    }

    public Optional<Action> action(String actionName) {
        return Optional.ofNullable(actions.get(actionName));
    }

    public Optional<StateVariable> stateVariable(String variableName) {
        return Optional.ofNullable(stateVariables.get(variableName));
    }

    /**
     * Resolves the data type tag of an argument through the state-variable table.
     * Returns null when the reference does not resolve.
     */
    public String dataTypeOf(Argument argument) {
        StateVariable variable = stateVariables.get(argument.relatedStateVariable());
        return variable != null ? variable.dataType() : null;
    }

    /**
     * Returns a copy of this service carrying the given action schema.
     */
    public Service withSchema(Map<String, Action> newActions, Map<String, StateVariable> newStateVariables) {
        return new Service(serviceType, serviceId, controlUrl, eventSubUrl, scpdUrl,
                newActions, newStateVariables);
    }

    @Override
    public String toString() {
        return "Service{" +
                "name='" + name() + '\'' +
                ", serviceType='" + serviceType + '\'' +
                ", controlUrl='" + controlUrl + '\'' +
                ", actions=" + actions.size() +
                '}';
    }
}
