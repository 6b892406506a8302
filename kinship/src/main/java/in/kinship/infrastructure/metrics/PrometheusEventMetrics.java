package in.kinship.infrastructure.metrics;

import in.kinship.domain.realtime.CloseReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * Prometheus implementation of {@link EventMetrics}.
 *
 * Key metrics:
 * - kinship_sse_connections_open - currently open streams
 * - kinship_sse_connections_total - streams opened since start
 * - kinship_sse_disconnects_total{reason} - streams closed, by reason
 * - kinship_events_published_total{event} - publish calls, by event name
 * - kinship_event_fanout - listeners per publish
 * - kinship_event_deliveries_total{outcome} - per-listener writes (delivered|failed)
 */
public class PrometheusEventMetrics implements EventMetrics {

    private final CollectorRegistry registry;

    private final Gauge openConnections;
    private final Counter connectionsTotal;
    private final Counter disconnects;
    private final Counter published;
    private final Histogram fanout;
    private final Counter deliveries;

    public PrometheusEventMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEventMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.openConnections = Gauge.build()
            .name("kinship_sse_connections_open")
            .help("Currently open event streams")
            .register(registry);

        this.connectionsTotal = Counter.build()
            .name("kinship_sse_connections_total")
            .help("Event streams opened since start")
            .register(registry);

        this.disconnects = Counter.build()
            .name("kinship_sse_disconnects_total")
            .help("Event streams closed")
            .labelNames("reason")
            .register(registry);

        this.published = Counter.build()
            .name("kinship_events_published_total")
            .help("Publish calls by event name")
            .labelNames("event")
            .register(registry);

        this.fanout = Histogram.build()
            .name("kinship_event_fanout")
            .help("Listeners resolved per publish")
            .buckets(0, 1, 2, 5, 10, 25, 50, 100, 250)
            .register(registry);

        this.deliveries = Counter.build()
            .name("kinship_event_deliveries_total")
            .help("Per-listener frame writes")
            .labelNames("outcome")
            .register(registry);
    }

    @Override
    public void recordConnectionOpened() {
        openConnections.inc();
        connectionsTotal.inc();
    }

    @Override
    public void recordConnectionClosed(CloseReason reason) {
        openConnections.dec();
        disconnects.labels(reason.name()).inc();
    }

    @Override
    public void recordPublished(String eventName, int listeners) {
        published.labels(eventName).inc();
        fanout.observe(listeners);
    }

    @Override
    public void recordDelivery(boolean success) {
        deliveries.labels(success ? "delivered" : "failed").inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
