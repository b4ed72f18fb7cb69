package fr.lapetina.tr064.domain.error;

/**
 * Raised locally, before any network call, when a service does not offer an action.
 */
public class ActionNotFoundException extends RouterException {

    private final String serviceName;
    private final String actionName;

    public ActionNotFoundException(String serviceName, String actionName) {
        super("Unknown action \"" + actionName + "\" for service \"" + serviceName + "\"");
        this.serviceName = serviceName;
        this.actionName = actionName;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getActionName() {
        return actionName;
    }
}
