package replay.spring.boot;

import replay.IdempotentOutcomeException;
import replay.LoadContext;
import replay.jdbc.ConnectionPool;
import replay.jdbc.DataSourceConnectionProvider;
import replay.jdbc.dialect.H2ErrorClassifier;
import replay.spi.ConnectionProvider;
import replay.spi.ErrorClassifier;
import replay.spi.FaultInjector;

import com.zaxxer.hikari.HikariDataSource;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReplayAutoConfigurationTest {

    private final ApplicationContextRunner defaultsRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    ReplayAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:replay_auto_test;DB_CLOSE_DELAY=-1",
                    "spring.datasource.driver-class-name=org.h2.Driver");

    private final ApplicationContextRunner runner = defaultsRunner
            .withPropertyValues("replay.worker-count=3");

    @Test
    void createsAllBeans() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("replayConnectionProvider"));
            assertTrue(ctx.containsBean("replayErrorClassifier"));
            assertTrue(ctx.containsBean("replayConnectionPool"));

            assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
            assertInstanceOf(H2ErrorClassifier.class, ctx.getBean(ErrorClassifier.class));
            assertEquals(3, ctx.getBean(ConnectionPool.class).size());
        });
    }

    @Test
    void poolExecutesAgainstApplicationDataSource() {
        runner.withPropertyValues("replay.name=boot", "replay.source-id=src-7").run(ctx -> {
            ConnectionPool pool = ctx.getBean(ConnectionPool.class);
            assertEquals("boot", pool.connection(0).name());
            assertEquals("src-7", pool.connection(0).sourceId());

            pool.connection(0).execute(LoadContext.background(),
                    List.of("CREATE TABLE IF NOT EXISTS boot_t (id INT PRIMARY KEY)", "DELETE FROM boot_t"));
            pool.connection(1).execute(LoadContext.background(), List.of("INSERT INTO boot_t VALUES (1)"));

            assertThrows(IdempotentOutcomeException.class, () ->
                    pool.connection(2).execute(LoadContext.background(), List.of("INSERT INTO boot_t VALUES (1)")));
        });
    }

    @Test
    void workerCountAbovePoolSizeFailsStartup() {
        runner.withPropertyValues("replay.worker-count=50").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
        });
    }

    @Test
    void startsWithDefaultWorkerCount() {
        defaultsRunner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertEquals(10, ctx.getBean(ConnectionPool.class).size());
        });
    }

    @Test
    void workerCountMayUseConfiguredPoolSize() {
        runner.withPropertyValues(
                "spring.datasource.hikari.maximum-pool-size=20",
                "replay.worker-count=20").run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertEquals(20, ctx.getBean(ConnectionPool.class).size());
        });
    }

    @Test
    void backsOffWhenCustomClassifierPresent() {
        runner.withUserConfiguration(CustomClassifierConfig.class).run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertSame(CustomClassifierConfig.CLASSIFIER, ctx.getBean(ErrorClassifier.class));
            assertEquals(3, ctx.getBean(ConnectionPool.class).size());
        });
    }

    @Test
    void unstartedDataSourceIsCheckedAgainstHikariDefault() {
        runner.withUserConfiguration(CustomClassifierConfig.class)
                .withPropertyValues("replay.worker-count=11")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    void effectiveMaximumPoolSizeOfUnstartedPool() {
        try (HikariDataSource unset = new HikariDataSource();
             HikariDataSource sized = new HikariDataSource()) {
            sized.setMaximumPoolSize(4);

            assertEquals(10, ReplayAutoConfiguration.effectiveMaximumPoolSize(unset));
            assertEquals(4, ReplayAutoConfiguration.effectiveMaximumPoolSize(sized));
        }
    }

    @Test
    void faultInjectorBeanIsNotWired() {
        runner.withUserConfiguration(FaultInjectorConfig.class).run(ctx -> {
            ConnectionPool pool = ctx.getBean(ConnectionPool.class);

            pool.connection(0).execute(LoadContext.background(),
                    List.of("CREATE TABLE IF NOT EXISTS fault_t (id INT PRIMARY KEY)"));

            assertEquals(0, FaultInjectorConfig.CALLS.get());
        });
    }

    @Test
    void notCreatedWithoutDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ReplayAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("replayConnectionPool")));
    }

    @Configuration
    static class CustomClassifierConfig {
        static final ErrorClassifier CLASSIFIER = new H2ErrorClassifier();

        @Bean
        ErrorClassifier customClassifier() {
            return CLASSIFIER;
        }
    }

    @Configuration
    static class FaultInjectorConfig {
        static final AtomicInteger CALLS = new AtomicInteger();

        @Bean
        FaultInjector alwaysFailing() {
            return (point, statements) -> {
                CALLS.incrementAndGet();
                return Optional.of(new SQLException("injected", "08S01"));
            };
        }
    }
}
