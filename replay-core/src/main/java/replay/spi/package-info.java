/**
 * Service-provider interfaces of the replay layer.
 *
 * <p>{@link replay.spi.ConnectionProvider} is the shared base handle, {@link replay.spi.ErrorClassifier}
 * the pure failure classifier, {@link replay.spi.MetricsExporter} the metrics sink, and
 * {@link replay.spi.FaultInjector} the test-only failure hook.
 */
package replay.spi;
