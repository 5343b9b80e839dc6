package replay.jdbc;

import com.zaxxer.hikari.HikariConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection descriptor of the target database.
 *
 * <p>Create instances via {@link #builder(String)} or {@link #fromProperties(Properties, String)}.
 */
public final class TargetConfig {
  static final String DEFAULT_POOL_NAME = "replay-target";
  static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

  private final String jdbcUrl;
  private final String user;
  private final String password;
  private final String poolName;
  private final int maxPoolSize;
  private final Duration connectTimeout;
  private final Map<String, String> sessionProperties;

  private TargetConfig(Builder builder) {
    this.jdbcUrl = Objects.requireNonNull(builder.jdbcUrl, "jdbcUrl");
    if (jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("jdbcUrl must not be blank");
    }
    if (builder.maxPoolSize < 0) {
      throw new IllegalArgumentException("maxPoolSize must be >= 0, got: " + builder.maxPoolSize);
    }
    if (builder.connectTimeout.isNegative() || builder.connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be > 0");
    }
    this.user = builder.user;
    this.password = builder.password;
    this.poolName = builder.poolName;
    this.maxPoolSize = builder.maxPoolSize;
    this.connectTimeout = builder.connectTimeout;
    this.sessionProperties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sessionProperties));
  }

  public static Builder builder(String jdbcUrl) {
    return new Builder(jdbcUrl);
  }

  /**
   * Reads a descriptor from flat properties. Recognized keys, relative to {@code prefix}:
   * {@code url} (required), {@code user}, {@code password}, {@code pool-name},
   * {@code max-pool-size}, {@code connect-timeout-ms} and {@code session.<name>}.
   *
   * @param props  source properties
   * @param prefix key prefix including the trailing dot (e.g. {@code "target."}), or empty
   * @return the descriptor
   * @throws IllegalArgumentException if {@code url} is missing or a number is malformed
   */
  public static TargetConfig fromProperties(Properties props, String prefix) {
    Objects.requireNonNull(props, "props");
    Objects.requireNonNull(prefix, "prefix");
    String url = props.getProperty(prefix + "url");
    if (url == null) {
      throw new IllegalArgumentException("Missing property: " + prefix + "url");
    }
    Builder builder = builder(url)
        .user(props.getProperty(prefix + "user"))
        .password(props.getProperty(prefix + "password"));
    String poolName = props.getProperty(prefix + "pool-name");
    if (poolName != null) {
      builder.poolName(poolName);
    }
    String maxPoolSize = props.getProperty(prefix + "max-pool-size");
    if (maxPoolSize != null) {
      builder.maxPoolSize(parseInt(prefix + "max-pool-size", maxPoolSize));
    }
    String connectTimeoutMs = props.getProperty(prefix + "connect-timeout-ms");
    if (connectTimeoutMs != null) {
      builder.connectTimeout(Duration.ofMillis(parseNumber(prefix + "connect-timeout-ms", connectTimeoutMs)));
    }
    String sessionPrefix = prefix + "session.";
    for (String key : props.stringPropertyNames()) {
      if (key.startsWith(sessionPrefix)) {
        builder.sessionProperty(key.substring(sessionPrefix.length()), props.getProperty(key));
      }
    }
    return builder.build();
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not an int: " + value, e);
    }
  }

  private static Long parseNumber(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
    }
  }

  public String jdbcUrl() {
    return jdbcUrl;
  }

  public String user() {
    return user;
  }

  public String poolName() {
    return poolName;
  }

  /**
   * @return configured maximum pool size, or 0 to size the pool from the worker count
   */
  public int maxPoolSize() {
    return maxPoolSize;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Map<String, String> sessionProperties() {
    return sessionProperties;
  }

  /**
   * Builds the HikariCP configuration of the shared base data source. The pool keeps
   * at least {@code workerCount} connections so that every worker holds one for its
   * whole lifetime.
   */
  HikariConfig toHikariConfig(int workerCount) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    if (user != null) {
      config.setUsername(user);
    }
    if (password != null) {
      config.setPassword(password);
    }
    config.setPoolName(poolName);
    config.setMaximumPoolSize(Math.max(maxPoolSize, workerCount));
    config.setMinimumIdle(0);
    config.setConnectionTimeout(connectTimeout.toMillis());
    sessionProperties.forEach(config::addDataSourceProperty);
    return config;
  }

  @Override
  public String toString() {
    return "TargetConfig{jdbcUrl=" + jdbcUrl + ", user=" + user + ", poolName=" + poolName
        + ", maxPoolSize=" + maxPoolSize + ", connectTimeout=" + connectTimeout + '}';
  }

  /** Builder for {@link TargetConfig}. */
  public static final class Builder {
    private final String jdbcUrl;
    private String user;
    private String password;
    private String poolName = DEFAULT_POOL_NAME;
    private int maxPoolSize;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private final Map<String, String> sessionProperties = new LinkedHashMap<>();

    private Builder(String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
    }

    public Builder user(String user) {
      this.user = user;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder poolName(String poolName) {
      this.poolName = Objects.requireNonNull(poolName, "poolName");
      return this;
    }

    /**
     * Sets the maximum size of the shared base pool.
     *
     * <p>Optional. Defaults to {@code 0}, meaning the worker count.
     */
    public Builder maxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
      return this;
    }

    /**
     * Sets how long obtaining a connection may block.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
      return this;
    }

    /** Adds a driver property, for example {@code sessionVariables} or {@code useSSL}. */
    public Builder sessionProperty(String name, String value) {
      sessionProperties.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public TargetConfig build() {
      return new TargetConfig(this);
    }
  }
}
