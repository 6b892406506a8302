package in.kinship.realtime;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventFrameCodecTest {

    private final EventFrameCodec codec = new EventFrameCodec();

    @Test
    void encodesEventAndDataLines() throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", "m1");
        payload.put("content", "hi");

        String frame = codec.encode("message-created", payload);

        assertEquals("event: message-created\ndata: {\"id\":\"m1\",\"content\":\"hi\"}\n\n", frame);
    }

    @Test
    void multiLinePayloadStaysOnOneDataLine() throws Exception {
        String frame = codec.encode("message-created", Map.of("content", "line one\nline two\r\n"));

        String[] lines = frame.split("\n", -1);
        assertEquals(4, lines.length);
        assertEquals("data: {\"content\":\"line one\\nline two\\r\\n\"}", lines[1]);
        assertEquals("", lines[2]);
        assertEquals("", lines[3]);
    }

    @Test
    void instantsAreIsoStrings() throws Exception {
        String frame = codec.encode("ping", Map.of("at", Instant.parse("2024-05-01T10:15:30Z")));

        assertEquals("event: ping\ndata: {\"at\":\"2024-05-01T10:15:30Z\"}\n\n", frame);
    }

    @Test
    void invalidEventNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.encode("", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> codec.encode(null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> codec.encode("a\nb", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> codec.encode("a\rb", Map.of()));
    }
}
