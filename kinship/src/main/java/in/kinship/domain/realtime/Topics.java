package in.kinship.domain.realtime;

/**
 * Topic naming. Only two namespaces exist: {@code user:<userId>} and
 * {@code conversation:<conversationId>}. New live features must pick a disjoint prefix.
 */
public final class Topics {
    public static final String USER_PREFIX = "user:";
    public static final String CONVERSATION_PREFIX = "conversation:";

    public static String user(String userId) {
        return USER_PREFIX + userId;
    }

    public static String conversation(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    public static boolean isUserTopic(String topic) {
        return hasSuffix(topic, USER_PREFIX);
    }

    public static boolean isConversationTopic(String topic) {
        return hasSuffix(topic, CONVERSATION_PREFIX);
    }

    public static boolean isKnown(String topic) {
        return isUserTopic(topic) || isConversationTopic(topic);
    }

    /**
     * The id part of a topic name, e.g. {@code 55} for {@code conversation:55}.
     */
    public static String idOf(String topic) {
        int idx = topic.indexOf(':');
        return idx < 0 ? topic : topic.substring(idx + 1);
    }

    private static boolean hasSuffix(String topic, String prefix) {
        return topic != null && topic.startsWith(prefix) && topic.length() > prefix.length();
    }

    private Topics() {}
}
