package in.kinship.infrastructure.metrics;

import in.kinship.domain.realtime.CloseReason;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Metrics registration
 * - Connection and publish metrics recorded and exported
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusEventMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusEventMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            )
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsAreRegistered() throws Exception {
        String body = scrape().body();

        assertTrue(body.contains("# TYPE kinship_sse_connections_open gauge"));
        assertTrue(body.contains("# TYPE kinship_event_fanout histogram"));
        // counter families drop the _total suffix
        assertTrue(body.contains("# TYPE kinship_sse_connections counter"));
        assertTrue(body.contains("# HELP kinship_sse_disconnects"));
        assertTrue(body.contains("# HELP kinship_events_published"));
        assertTrue(body.contains("# HELP kinship_event_deliveries"));
    }

    @Test
    public void testConnectionMetrics() throws Exception {
        metrics.recordConnectionOpened();
        metrics.recordConnectionOpened();
        metrics.recordConnectionClosed(CloseReason.WRITE_FAILED);

        String body = scrape().body();

        assertTrue(body.contains("kinship_sse_connections_open 1.0"), body);
        assertTrue(body.contains("kinship_sse_connections_total 2.0"), body);
        assertTrue(body.contains("kinship_sse_disconnects_total{reason=\"WRITE_FAILED\",} 1.0"), body);
    }

    @Test
    public void testPublishMetrics() throws Exception {
        metrics.recordPublished("message-created", 3);
        metrics.recordPublished("message-created", 0);
        metrics.recordDelivery(true);
        metrics.recordDelivery(true);
        metrics.recordDelivery(false);

        String body = scrape().body();

        assertTrue(body.contains("kinship_events_published_total{event=\"message-created\",} 2.0"), body);
        assertTrue(body.contains("kinship_event_fanout_count 2.0"), body);
        assertTrue(body.contains("kinship_event_fanout_sum 3.0"), body);
        assertTrue(body.contains("kinship_event_deliveries_total{outcome=\"delivered\",} 2.0"), body);
        assertTrue(body.contains("kinship_event_deliveries_total{outcome=\"failed\",} 1.0"), body);
    }
}
