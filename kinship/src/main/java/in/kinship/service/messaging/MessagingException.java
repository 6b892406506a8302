package in.kinship.service.messaging;

/**
 * Base class of the messaging errors the HTTP layer turns into 4xx responses.
 */
public abstract class MessagingException extends RuntimeException {

    protected MessagingException(String message) {
        super(message);
    }

    /**
     * HTTP status this error maps to.
     */
    public abstract int status();
}
