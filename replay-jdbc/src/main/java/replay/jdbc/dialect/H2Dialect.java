package replay.jdbc.dialect;

import replay.jdbc.spi.Dialect;
import replay.spi.ErrorClassifier;

import java.util.List;

/**
 * H2 dialect.
 */
public final class H2Dialect implements Dialect {
  private static final ErrorClassifier CLASSIFIER = new H2ErrorClassifier();

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public ErrorClassifier errorClassifier() {
    return CLASSIFIER;
  }
}
