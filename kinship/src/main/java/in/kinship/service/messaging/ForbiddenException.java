package in.kinship.service.messaging;

public class ForbiddenException extends MessagingException {
    private final String userId;

    public ForbiddenException(String message, String userId) {
        super(message);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public int status() {
        return 403;
    }
}
