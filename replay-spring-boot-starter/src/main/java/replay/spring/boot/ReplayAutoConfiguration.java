package replay.spring.boot;

import com.zaxxer.hikari.HikariDataSource;
import replay.jdbc.ConnectionPool;
import replay.jdbc.DataSourceConnectionProvider;
import replay.jdbc.dialect.Dialects;
import replay.jdbc.dialect.GenericErrorClassifier;
import replay.spi.ConnectionProvider;
import replay.spi.ErrorClassifier;
import replay.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the replay connection pool.
 *
 * <p>Wires a {@link ConnectionPool} of {@code replay.worker-count} connections on top of
 * the application {@link DataSource}. The data source stays owned by the application;
 * closing the pool only returns its connections.
 *
 * <p>Fault injection is never wired here: the pool always runs with
 * {@link replay.spi.FaultInjector#NONE}, whatever beans the context holds.
 *
 * @see ReplayProperties
 * @see ReplayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ConnectionPool.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ReplayProperties.class)
public class ReplayAutoConfiguration {

    // HikariConfig falls back to this size until the pool is started
    private static final int HIKARI_DEFAULT_POOL_SIZE = 10;

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider replayConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ErrorClassifier.class)
    public ErrorClassifier replayErrorClassifier(DataSource dataSource) {
        try {
            return Dialects.detect(dataSource).errorClassifier();
        } catch (IllegalArgumentException e) {
            // no registered dialect for this URL
            return new GenericErrorClassifier();
        }
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConnectionPool replayConnectionPool(ReplayProperties props,
            DataSource dataSource,
            ConnectionProvider connectionProvider,
            ErrorClassifier errorClassifier,
            ObjectProvider<MetricsExporter> metricsProvider) {

        if (dataSource instanceof HikariDataSource hikari) {
            int maxPoolSize = effectiveMaximumPoolSize(hikari);
            if (maxPoolSize < props.getWorkerCount()) {
                throw new IllegalStateException("replay.worker-count (" + props.getWorkerCount()
                        + ") exceeds the maximum pool size of the data source (" + maxPoolSize + ")");
            }
        }

        ConnectionPool.Builder builder = ConnectionPool.builder()
                .connectionProvider(connectionProvider)
                .name(props.getName())
                .sourceId(props.getSourceId())
                .workerCount(props.getWorkerCount())
                .errorClassifier(errorClassifier)
                .queryRetryPolicy(props.getQuery().toPolicy())
                .executeRetryPolicy(props.getExecute().toPolicy());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    /**
     * Maximum size the Hikari pool has or will have once started. An unstarted pool
     * still reports the unset value, which Hikari replaces by its default on start.
     */
    static int effectiveMaximumPoolSize(HikariDataSource hikari) {
        int configured = hikari.getMaximumPoolSize();
        return configured > 0 ? configured : HIKARI_DEFAULT_POOL_SIZE;
    }
}
