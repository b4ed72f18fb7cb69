package fr.lapetina.tr064.domain.error;

/**
 * HTTP-level rejection of the credentials (status 401).
 * Protocol-level security faults are reported as {@link ErrorKind#SECURITY} instead.
 */
public class RouterAuthorizationException extends RouterConnectionException {

    public RouterAuthorizationException(String message) {
        super(message);
    }
}
