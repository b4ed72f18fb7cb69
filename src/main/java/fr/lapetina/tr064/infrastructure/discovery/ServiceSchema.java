package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.model.Action;
import fr.lapetina.tr064.domain.model.StateVariable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Action and state-variable tables of one service, as read from its action-schema document.
 */
public record ServiceSchema(
        Map<String, Action> actions,
        Map<String, StateVariable> stateVariables
) {
    public ServiceSchema {
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        stateVariables = Collections.unmodifiableMap(new LinkedHashMap<>(stateVariables));
    }
}
