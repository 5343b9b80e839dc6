package replay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import replay.spi.MetricsExporter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers timers and counters with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends. Every meter carries the
 * tags {@code name} (connection display name) and {@code source_id}.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code replay.query.duration}: latency of successful queries</li>
 *   <li>{@code replay.execute.duration}: latency of successful statement batches</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code replay.execute.errors}: failed execute attempts, retried or not</li>
 *   <li>{@code replay.connection.resets}: connection resets, tagged {@code outcome}
 *       ({@code success} or {@code failure})</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String queryDurationName;
  private final String executeDurationName;
  private final String executeErrorsName;
  private final String resetsName;
  private final Map<Meter.Id, Meter> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "replay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "replay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "dm.loader"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.queryDurationName = namePrefix + ".query.duration";
    this.executeDurationName = namePrefix + ".execute.duration";
    this.executeErrorsName = namePrefix + ".execute.errors";
    this.resetsName = namePrefix + ".connection.resets";
  }

  @Override
  public void recordQueryLatency(String name, String sourceId, Duration latency) {
    if (closed) return;
    timer(queryDurationName, "Latency of successful queries", name, sourceId).record(latency);
  }

  @Override
  public void recordExecuteLatency(String name, String sourceId, Duration latency) {
    if (closed) return;
    timer(executeDurationName, "Latency of successful statement batches", name, sourceId).record(latency);
  }

  @Override
  public void incrementExecutionError(String name, String sourceId) {
    if (closed) return;
    track(Counter.builder(executeErrorsName)
        .description("Failed execute attempts")
        .tag("name", name)
        .tag("source_id", sourceId)
        .register(registry))
        .increment();
  }

  @Override
  public void incrementConnectionReset(String name, String sourceId, boolean succeeded) {
    if (closed) return;
    track(Counter.builder(resetsName)
        .description("Connection resets after a lost connection")
        .tag("name", name)
        .tag("source_id", sourceId)
        .tag("outcome", succeeded ? "success" : "failure")
        .register(registry))
        .increment();
  }

  private Timer timer(String meterName, String description, String name, String sourceId) {
    return track(Timer.builder(meterName)
        .description(description)
        .tag("name", name)
        .tag("source_id", sourceId)
        .publishPercentileHistogram()
        .register(registry));
  }

  private <M extends Meter> M track(M meter) {
    meters.putIfAbsent(meter.getId(), meter);
    return meter;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@code ConnectionPool} is closed) to prevent stale series.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters.values()) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    if (first != null) throw first;
  }
}
