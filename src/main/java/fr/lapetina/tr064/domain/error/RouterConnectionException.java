package fr.lapetina.tr064.domain.error;

/**
 * The router could not be reached, refused the request before processing it,
 * or answered with something that is not a protocol response.
 */
public class RouterConnectionException extends RouterException {

    public RouterConnectionException(String message) {
        super(message);
    }

    public RouterConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
