package fr.lapetina.tr064.domain.error;

public class MalformedDescriptorException extends RouterException {

    public MalformedDescriptorException(String message) {
        super(message);
    }

    public MalformedDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
