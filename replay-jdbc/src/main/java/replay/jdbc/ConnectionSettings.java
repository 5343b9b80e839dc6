package replay.jdbc;

import replay.retry.RetryPolicy;
import replay.spi.ErrorClassifier;
import replay.spi.FaultInjector;
import replay.spi.MetricsExporter;

import java.util.Objects;

/**
 * Collaborators shared by all connections of one {@link ConnectionPool}.
 */
record ConnectionSettings(
    ErrorClassifier classifier,
    MetricsExporter metrics,
    FaultInjector faultInjector,
    RetryPolicy queryPolicy,
    RetryPolicy executePolicy) {

  ConnectionSettings {
    Objects.requireNonNull(classifier, "classifier");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(faultInjector, "faultInjector");
    Objects.requireNonNull(queryPolicy, "queryPolicy");
    Objects.requireNonNull(executePolicy, "executePolicy");
  }
}
