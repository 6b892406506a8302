package in.kinship.service.messaging;

public class NotFoundException extends MessagingException {
    private final String resourceId;

    public NotFoundException(String message, String resourceId) {
        super(message);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }

    @Override
    public int status() {
        return 404;
    }
}
