package fr.lapetina.tr064.domain.error;

/**
 * Base exception for all failures talking to the router.
 */
public class RouterException extends RuntimeException {

    public RouterException(String message) {
        super(message);
    }

    public RouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
