package logsink.spi;

/**
 * Observability hook for exporting worker and registry counters to a metrics
 * backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface
 * to bridge into Micrometer (see the {@code logsink-micrometer} module) or
 * another monitoring system. Implementations are called from the worker thread
 * and from caller threads concurrently and must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages handed to a sink without error.
     */
    void incrementDelivered();

    /**
     * Increments the count of messages rejected because the worker queue was
     * full or the worker was closed.
     */
    void incrementDropped();

    /**
     * Increments the count of failed deliveries (a sink threw).
     *
     * @param kind the sink kind name
     */
    void incrementDeliveryFailure(String kind);

    /**
     * Records the current depth of the worker queue.
     *
     * @param depth number of queued messages
     */
    void recordQueueDepth(int depth);

    /**
     * Records how many sinks of a kind are currently live.
     *
     * @param kind the sink kind name
     * @param count live sinks of that kind
     */
    default void recordLiveSinks(String kind, int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementDeliveryFailure(String kind) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
