package cable.spi;

/**
 * Observability hook for exporting bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code cable-micrometer} bridges this
 * interface to Micrometer.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages durably written by the publisher.
     */
    void incrementPublished();

    /**
     * Increments the count of publish attempts the store rejected.
     */
    void incrementPublishFailure();

    /**
     * Increments the count of messages a handler processed without throwing.
     */
    void incrementDelivered();

    /**
     * Increments the count of messages dropped because a subscriber queue was full.
     */
    void incrementDropped();

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerFailure();

    /**
     * Records how many expired messages one sweep removed.
     *
     * @param count rows deleted (always positive)
     */
    default void recordPurged(long count) {
    }

    /**
     * Records the poller cursor after a batch was read.
     *
     * @param lastSeenId highest message id polled so far
     */
    void recordCursor(long lastSeenId);

    /**
     * Records the age of the oldest message in the latest polled batch.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    default void recordPollLagMs(long lagMs) {
    }

    /**
     * Records the number of registered subscriptions.
     *
     * @param count active subscriptions
     */
    void recordActiveSubscriptions(int count);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementPublishFailure() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void recordCursor(long lastSeenId) {
        }

        @Override
        public void recordActiveSubscriptions(int count) {
        }
    }
}
