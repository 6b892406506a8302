package in.kinship.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.kinship.util.Json;

/**
 * Encodes event frames:
 * <pre>
 * event: message-created
 * data: {"id":"m1"}
 *
 * </pre>
 * Payload JSON is compact, so it always fits on one {@code data:} line.
 */
public final class EventFrameCodec {
    private static final String EVENT_PREFIX = "event: ";
    private static final String DATA_PREFIX = "data: ";

    private final ObjectMapper mapper;

    public EventFrameCodec() {
        this(Json.newMapper());
    }

    public EventFrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(String eventName, Object payload) throws JsonProcessingException {
        if (eventName == null || eventName.isEmpty()
                || eventName.indexOf('\n') >= 0 || eventName.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Invalid event name: " + eventName);
        }
        String data = mapper.writeValueAsString(payload);
        return EVENT_PREFIX + eventName + '\n' + DATA_PREFIX + data + "\n\n";
    }
}
