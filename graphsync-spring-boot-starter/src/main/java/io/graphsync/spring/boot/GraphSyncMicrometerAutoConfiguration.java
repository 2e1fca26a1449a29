package io.graphsync.spring.boot;

import io.graphsync.micrometer.MicrometerMetricsExporter;
import io.graphsync.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} exists and {@code graphsync.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link GraphSyncAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the consumer.
 */
@AutoConfiguration(before = GraphSyncAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "graphsync.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(GraphSyncProperties.class)
public class GraphSyncMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    @ConditionalOnBean(MeterRegistry.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry,
                                                               GraphSyncProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
