package replay.spi;

import java.time.Duration;

/**
 * Observability hook for exporting replay latencies and error counts to a metrics backend.
 *
 * <p>Every signal is labeled by the connection's display name and source id. The
 * {@link #NOOP} instance discards everything and is the default in tests.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records the latency of a successful query.
     *
     * @param name     connection display name
     * @param sourceId migration source id
     * @param latency  elapsed time of the successful attempt
     */
    void recordQueryLatency(String name, String sourceId, Duration latency);

    /**
     * Increments the count of failed execute attempts. Called once per failed attempt,
     * whether or not the attempt is retried.
     *
     * @param name     connection display name
     * @param sourceId migration source id
     */
    void incrementExecutionError(String name, String sourceId);

    /**
     * Records the latency of a successful statement batch.
     *
     * @param name     connection display name
     * @param sourceId migration source id
     * @param latency  elapsed time of the successful attempt
     */
    default void recordExecuteLatency(String name, String sourceId, Duration latency) {
    }

    /**
     * Counts a connection reset.
     *
     * @param name      connection display name
     * @param sourceId  migration source id
     * @param succeeded whether a replacement connection was obtained
     */
    default void incrementConnectionReset(String name, String sourceId, boolean succeeded) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordQueryLatency(String name, String sourceId, Duration latency) {
        }

        @Override
        public void incrementExecutionError(String name, String sourceId) {
        }
    }
}
