package replay.jdbc.spi;

import replay.spi.ErrorClassifier;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific error classification used by the
 * retry loop. Register custom dialects via
 * {@code META-INF/services/replay.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB, MariaDB), PostgreSQL, H2.
 *
 * @see replay.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Classifier for the errors raised by this database's driver.
   */
  ErrorClassifier errorClassifier();
}
