package in.kinship.domain.realtime;

/**
 * Event names written on the {@code event:} line of a frame.
 */
public enum EventName {
    // Stream protocol
    CONNECTED("connected"),
    PING("ping"),

    // Conversation topic
    MESSAGE_CREATED("message-created"),
    MESSAGE_EDITED("message-edited"),
    MESSAGE_DELETED("message-deleted"),
    TYPING_STARTED("typing-started"),
    TYPING_STOPPED("typing-stopped"),

    // User topic
    NOTIFICATION_CREATED("notification-created");

    private final String wireName;

    EventName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
