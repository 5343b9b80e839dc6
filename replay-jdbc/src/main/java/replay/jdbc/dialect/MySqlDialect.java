package replay.jdbc.dialect;

import replay.jdbc.spi.Dialect;
import replay.spi.ErrorClassifier;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB and MariaDB.
 */
public final class MySqlDialect implements Dialect {
  private static final ErrorClassifier CLASSIFIER = new MySqlErrorClassifier();

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public ErrorClassifier errorClassifier() {
    return CLASSIFIER;
  }
}
