package in.kinship.service.messaging;

public class InvalidRequestException extends MessagingException {

    public InvalidRequestException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 400;
    }
}
