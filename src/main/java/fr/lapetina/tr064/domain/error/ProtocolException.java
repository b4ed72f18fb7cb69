package fr.lapetina.tr064.domain.error;

/**
 * A fault reported by the router after processing a SOAP request.
 *
 * <p>The message keeps the raw device description for diagnostics; callers
 * should branch on {@link #getKind()} instead of the text.
 */
public class ProtocolException extends RouterException {

    private final ErrorKind kind;
    private final String errorCode;
    private final String errorDescription;

    public ProtocolException(ErrorKind kind, String errorCode, String errorDescription, String message) {
        super(message);
        this.kind = kind != null ? kind : ErrorKind.UNKNOWN;
        this.errorCode = errorCode;
        this.errorDescription = errorDescription;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    /**
     * True for faults that correspond to an index error in collection terms.
     */
    public boolean isIndexError() {
        return kind.isIndexError();
    }

    /**
     * True for faults that correspond to a failed key lookup.
     */
    public boolean isLookupError() {
        return kind.isLookupError();
    }
}
