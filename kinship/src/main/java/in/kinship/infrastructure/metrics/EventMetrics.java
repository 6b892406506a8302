package in.kinship.infrastructure.metrics;

import in.kinship.domain.realtime.CloseReason;

/**
 * Metrics recorded by the live event layer.
 */
public interface EventMetrics {

    void recordConnectionOpened();

    void recordConnectionClosed(CloseReason reason);

    void recordPublished(String eventName, int listeners);

    void recordDelivery(boolean success);

    /**
     * Discards everything. Used in tests and when metrics are disabled.
     */
    EventMetrics NOOP = new EventMetrics() {
        @Override
        public void recordConnectionOpened() {
        }

        @Override
        public void recordConnectionClosed(CloseReason reason) {
        }

        @Override
        public void recordPublished(String eventName, int listeners) {
        }

        @Override
        public void recordDelivery(boolean success) {
        }
    };
}
