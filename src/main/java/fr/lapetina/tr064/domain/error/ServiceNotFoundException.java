package fr.lapetina.tr064.domain.error;

/**
 * Raised locally when a service name does not resolve in the discovered schema.
 */
public class ServiceNotFoundException extends RouterException {

    private final String serviceName;

    public ServiceNotFoundException(String serviceName) {
        super("Unknown service: \"" + serviceName + "\"");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
