package replay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import replay.retry.BackoffStrategy;
import replay.retry.RetryPolicy;

import java.time.Duration;

/**
 * Configuration properties for the replay connection pool.
 *
 * @see ReplayAutoConfiguration
 */
@ConfigurationProperties(prefix = "replay")
public class ReplayProperties {

    /**
     * Display name of the pool's connections, used in logs and metric tags.
     */
    private String name = "loader";

    /**
     * Migration source id, used in logs and metric tags.
     */
    private String sourceId = "";

    /**
     * Number of connections, one per loader worker. Must not exceed the maximum size
     * of the application's connection pool. The default fits Hikari's default pool size.
     */
    private int workerCount = 10;

    private final Retry query = new Retry(10, Duration.ofSeconds(1), BackoffStrategy.STABLE);
    private final Retry execute = new Retry(10, Duration.ofSeconds(2), BackoffStrategy.LINEAR_INCREASE);
    private final Metrics metrics = new Metrics();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public Retry getQuery() {
        return query;
    }

    public Retry getExecute() {
        return execute;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        private int maxAttempts;
        private Duration firstDelay;
        private BackoffStrategy backoff;

        Retry(int maxAttempts, Duration firstDelay, BackoffStrategy backoff) {
            this.maxAttempts = maxAttempts;
            this.firstDelay = firstDelay;
            this.backoff = backoff;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getFirstDelay() {
            return firstDelay;
        }

        public void setFirstDelay(Duration firstDelay) {
            this.firstDelay = firstDelay;
        }

        public BackoffStrategy getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffStrategy backoff) {
            this.backoff = backoff;
        }

        RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, firstDelay, backoff);
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "replay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
