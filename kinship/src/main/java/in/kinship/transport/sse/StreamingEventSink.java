package in.kinship.transport.sse;

import in.kinship.realtime.EventSink;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Event sink backed by a bounded queue that one stream thread drains into the HTTP response.
 *
 * {@link #send(String)} never blocks: a full queue means the client is not reading fast enough
 * and is reported as a failed write. Frames are written in the order they were queued.
 */
public final class StreamingEventSink implements EventSink {
    // queued by close() to wake a waiting pump
    private static final String WAKE_UP = "";
    private static final long POLL_MILLIS = 1000;

    private final BlockingQueue<String> queue;
    private final int capacity;
    private volatile boolean closed;

    public StreamingEventSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public void send(String frame) throws IOException {
        if (closed) {
            throw new IOException("Event stream closed");
        }
        if (frame.isEmpty()) {
            return;
        }
        if (!queue.offer(frame)) {
            throw new IOException("Outbound queue full (" + capacity + " frames)");
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.offer(WAKE_UP);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Write queued frames to {@code out}, flushing after each one, until the sink is closed.
     * Frames still queued at close are dropped.
     *
     * @throws IOException if writing to {@code out} fails
     */
    public void pump(OutputStream out) throws IOException, InterruptedException {
        while (!closed) {
            String frame = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (frame == null || frame.isEmpty() || closed) {
                continue;
            }
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }
}
