package io.graphsync.spring.boot;

import io.graphsync.aggregate.AggregateLoader;
import io.graphsync.consumer.OutboxConsumer;
import io.graphsync.dispatch.AggregateDispatcher;
import io.graphsync.dispatch.TombstoneHandler;
import io.graphsync.failed.FailedEventManager;
import io.graphsync.jdbc.DataSourceConnectionProvider;
import io.graphsync.jdbc.reader.JdbcAggregateReader;
import io.graphsync.jdbc.store.AbstractJdbcOutboxStore;
import io.graphsync.jdbc.store.JdbcOutboxStores;
import io.graphsync.neo4j.Neo4jGraphWriter;
import io.graphsync.projection.GraphProjector;
import io.graphsync.spi.AggregateReader;
import io.graphsync.spi.ConnectionProvider;
import io.graphsync.spi.GraphWriter;
import io.graphsync.spi.MetricsExporter;
import io.graphsync.spi.OutboxStore;
import org.neo4j.driver.Driver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.LinkedHashSet;

/**
 * Auto-configuration for the graph sync consumer.
 *
 * <p>Wires an {@link OutboxConsumer} from the application {@link DataSource}, a
 * {@link GraphWriter} (a {@link Neo4jGraphWriter} over the Boot-managed {@link Driver}
 * unless the application defines its own) and {@link GraphSyncProperties}. The Neo4j
 * writer creates its uniqueness constraints before any bean can write through it. The
 * consumer starts with the context and drains on shutdown.
 *
 * @see GraphSyncProperties
 * @see GraphSyncMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, Neo4jAutoConfiguration.class})
@ConditionalOnClass(OutboxConsumer.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(GraphSyncProperties.class)
public class GraphSyncAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(OutboxStore.class)
    public AbstractJdbcOutboxStore outboxStore(DataSource dataSource, GraphSyncProperties props) {
        return JdbcOutboxStores.detect(dataSource, props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(AggregateReader.class)
    public JdbcAggregateReader aggregateReader() {
        return new JdbcAggregateReader();
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregateLoader aggregateLoader(ConnectionProvider connectionProvider, AggregateReader aggregateReader) {
        return new AggregateLoader(connectionProvider, aggregateReader);
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphProjector graphProjector(GraphWriter graphWriter) {
        return new GraphProjector(graphWriter);
    }

    @Bean
    @ConditionalOnMissingBean
    public TombstoneHandler tombstoneHandler(GraphWriter graphWriter) {
        return new TombstoneHandler(graphWriter);
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregateDispatcher aggregateDispatcher(AggregateLoader loader, GraphProjector projector,
                                                   TombstoneHandler tombstoneHandler) {
        return AggregateDispatcher.standard(loader, projector, tombstoneHandler);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "graphsync.consumer", name = "enabled", matchIfMissing = true)
    public OutboxConsumer outboxConsumer(GraphSyncProperties props,
                                         ConnectionProvider connectionProvider,
                                         OutboxStore outboxStore,
                                         AggregateDispatcher dispatcher,
                                         ObjectProvider<MetricsExporter> metricsProvider) {
        GraphSyncProperties.Consumer consumer = props.getConsumer();
        OutboxConsumer.Builder builder = OutboxConsumer.builder()
            .connectionProvider(connectionProvider)
            .outboxStore(outboxStore)
            .dispatcher(dispatcher)
            .batchSize(consumer.getBatchSize())
            .maxAttempts(consumer.getMaxAttempts())
            .pollInterval(consumer.getPollInterval())
            .processingTimeout(consumer.getProcessingTimeout())
            .drainTimeout(consumer.getDrainTimeout())
            .watchedTables(new LinkedHashSet<>(props.getWatch().getTables()))
            .watchedAggregateTypes(new LinkedHashSet<>(props.getWatch().getAggregateTypes()))
            .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
        if (consumer.getOwnerId() != null && !consumer.getOwnerId().isBlank()) {
            builder.ownerId(consumer.getOwnerId());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public FailedEventManager failedEventManager(ConnectionProvider connectionProvider, OutboxStore outboxStore) {
        return new FailedEventManager(connectionProvider, outboxStore);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Driver.class)
    static class Neo4jWriterConfiguration {

        @Bean
        @ConditionalOnMissingBean(GraphWriter.class)
        @ConditionalOnBean(Driver.class)
        public Neo4jGraphWriter graphWriter(Driver driver, GraphSyncProperties props) {
            Neo4jGraphWriter writer = new Neo4jGraphWriter(driver, props.getNeo4j().getDatabase());
            if (props.getNeo4j().isCreateConstraints()) {
                writer.ensureConstraints();
            }
            return writer;
        }
    }
}
