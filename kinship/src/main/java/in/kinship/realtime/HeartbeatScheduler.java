package in.kinship.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodic heartbeat tasks for live connections, all on one daemon scheduler thread.
 *
 * A tick that throws is cancelled and reported to the failure callback; it is never retried.
 *
 * Usage:
 * <pre>
 * HeartbeatScheduler heartbeats = new HeartbeatScheduler(Duration.ofSeconds(30));
 * heartbeats.schedule(clientId,
 *     () -> sendPing(),
 *     error -> close(clientId));
 * // on close:
 * heartbeats.cancel(clientId);
 * </pre>
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public HeartbeatScheduler(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + interval);
        }
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sse-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Start heartbeats for a connection. Replaces any task already scheduled under that id.
     */
    public void schedule(String connectionId, Runnable tick, Consumer<Throwable> onFailure) {
        if (!running) {
            log.warn("[{}] Heartbeat scheduler stopped, not scheduling", connectionId);
            return;
        }

        long periodMs = interval.toMillis();
        ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (Exception e) {
                log.warn("[{}] Heartbeat tick failed: {}", connectionId, e.toString());
                cancel(connectionId);
                notifyFailure(connectionId, onFailure, e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);

        ScheduledFuture<?> previous = tasks.put(connectionId, task);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("[{}] Heartbeat scheduled every {}ms", connectionId, periodMs);
    }

    /**
     * Stop heartbeats for a connection. Safe to call for unknown ids.
     */
    public void cancel(String connectionId) {
        ScheduledFuture<?> task = tasks.remove(connectionId);
        if (task != null) {
            task.cancel(false);
            log.debug("[{}] Heartbeat cancelled", connectionId);
        }
    }

    public boolean isScheduled(String connectionId) {
        return tasks.containsKey(connectionId);
    }

    public int activeCount() {
        return tasks.size();
    }

    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping heartbeat scheduler ({} active)", tasks.size());

        tasks.values().forEach(task -> task.cancel(false));
        tasks.clear();

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void notifyFailure(String connectionId, Consumer<Throwable> onFailure, Exception error) {
        if (onFailure == null) {
            return;
        }
        try {
            onFailure.accept(error);
        } catch (Exception e) {
            log.error("[{}] Heartbeat failure callback threw exception", connectionId, e);
        }
    }
}
