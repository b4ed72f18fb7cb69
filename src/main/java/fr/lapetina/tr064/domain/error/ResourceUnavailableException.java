package fr.lapetina.tr064.domain.error;

/**
 * A descriptor resource is not provided by the device
 * (the router answers with an HTML page instead).
 */
public class ResourceUnavailableException extends RouterConnectionException {

    public ResourceUnavailableException(String message) {
        super(message);
    }
}
