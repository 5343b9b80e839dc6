package replay.jdbc.dialect;

import replay.jdbc.spi.Dialect;
import replay.spi.ErrorClassifier;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect implements Dialect {
  private static final ErrorClassifier CLASSIFIER = new PostgresErrorClassifier();

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public ErrorClassifier errorClassifier() {
    return CLASSIFIER;
  }
}
