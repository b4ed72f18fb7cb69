package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.MalformedDescriptorException;
import fr.lapetina.tr064.domain.model.Action;
import fr.lapetina.tr064.domain.model.Argument;
import fr.lapetina.tr064.domain.model.StateVariable;
import fr.lapetina.tr064.domain.model.ValueRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.child;
import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.childElements;
import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.childText;
import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.localName;

/**
 * Parses an action-schema (SCPD) document into its action and state-variable tables.
 *
 * Every argument must reference a state variable declared in the same document.
 */
public final class ScpdParser {

    private static final Logger log = LoggerFactory.getLogger(ScpdParser.class);

    public ServiceSchema parse(String xml) {
        Element root = XmlSupport.parse(xml).getDocumentElement();
        if (!"scpd".equals(localName(root))) {
            throw new MalformedDescriptorException("Expected <scpd> element but found <" + localName(root) + ">");
        }

        Map<String, Action> actions = new LinkedHashMap<>();
        Map<String, StateVariable> stateVariables = new LinkedHashMap<>();

        child(root, "actionList").ifPresent(list -> {
            for (Element element : childElements(list, "action")) {
                Action action = parseAction(element);
                actions.put(action.name(), action);
            }
        });
        child(root, "serviceStateTable").ifPresent(table -> {
            for (Element element : childElements(table, "stateVariable")) {
                StateVariable variable = parseStateVariable(element);
                stateVariables.put(variable.name(), variable);
            }
        });

        verifyReferences(actions, stateVariables);
        log.debug("Action schema parsed: actions={}, stateVariables={}", actions.size(), stateVariables.size());
        return new ServiceSchema(actions, stateVariables);
    }

    private Action parseAction(Element element) {
        String name = childText(element, "name");
        if (name == null || name.isEmpty()) {
            throw new MalformedDescriptorException("Action without <name>");
        }
        List<Argument> arguments = new ArrayList<>();
        child(element, "argumentList").ifPresent(list -> {
            for (Element argument : childElements(list, "argument")) {
                String argumentName = childText(argument, "name");
                if (argumentName == null || argumentName.isEmpty()) {
                    throw new MalformedDescriptorException("Argument without <name> in action " + name);
                }
                arguments.add(new Argument(
                        argumentName,
                        Argument.Direction.fromDescriptor(childText(argument, "direction")),
                        childText(argument, "relatedStateVariable")));
            }
        });
        return new Action(name, arguments);
    }

    private StateVariable parseStateVariable(Element element) {
        String name = childText(element, "name");
        if (name == null || name.isEmpty()) {
            throw new MalformedDescriptorException("State variable without <name>");
        }
        List<String> allowedValues = child(element, "allowedValueList")
                .map(list -> childElements(list, "allowedValue").stream().map(XmlSupport::text).toList())
                .orElse(List.of());
        ValueRange range = child(element, "allowedValueRange")
                .map(r -> new ValueRange(childText(r, "minimum"), childText(r, "maximum"), childText(r, "step")))
                .orElse(null);
        String dataType = childText(element, "dataType");

        return new StateVariable(
                name,
                dataType,
                childText(element, "defaultValue"),
                allowedValues,
                range,
                "yes".equalsIgnoreCase(element.getAttribute("sendEvents").trim()));
    }

    private void verifyReferences(Map<String, Action> actions, Map<String, StateVariable> stateVariables) {
        for (Action action : actions.values()) {
            for (Argument argument : action.arguments()) {
                String reference = argument.relatedStateVariable();
                if (reference == null || !stateVariables.containsKey(reference)) {
                    throw new MalformedDescriptorException("Argument " + action.name() + "." + argument.name()
                            + " references unknown state variable: " + reference);
                }
            }
        }
    }
}
