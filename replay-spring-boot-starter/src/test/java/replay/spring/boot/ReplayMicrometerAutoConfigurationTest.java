package replay.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import replay.LoadContext;
import replay.jdbc.ConnectionPool;
import replay.micrometer.MicrometerMetricsExporter;
import replay.spi.MetricsExporter;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplayMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ReplayMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("replay.metrics.name-prefix=dm.loader").run(ctx -> {
            var exporter = ctx.getBean(MicrometerMetricsExporter.class);
            exporter.recordQueryLatency("w", "s", Duration.ofMillis(5));

            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("dm.loader.query.duration").timer());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("replay.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void poolReportsThroughExporter() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DataSourceAutoConfiguration.class,
                        ReplayMicrometerAutoConfiguration.class,
                        ReplayAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:replay_metrics_test;DB_CLOSE_DELAY=-1",
                        "replay.worker-count=1")
                .run(ctx -> {
                    ConnectionPool pool = ctx.getBean(ConnectionPool.class);
                    pool.connection(0).query(LoadContext.background(), "SELECT 1", rs -> rs.getInt(1));

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertNotNull(registry.find("replay.query.duration").tag("name", "loader").timer());
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
