package io.graphsync.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the graph sync consumer.
 *
 * @see GraphSyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "graphsync")
public class GraphSyncProperties {

    /**
     * Database table name for outbox events.
     */
    private String tableName = "outbox_events";

    private final Consumer consumer = new Consumer();
    private final Watch watch = new Watch();
    private final Neo4j neo4j = new Neo4j();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Watch getWatch() {
        return watch;
    }

    public Neo4j getNeo4j() {
        return neo4j;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Consumer {
        /**
         * Whether to create and start the polling consumer.
         */
        private boolean enabled = true;
        private int batchSize = 50;
        private int maxAttempts = 5;
        private Duration pollInterval = Duration.ofSeconds(5);
        /**
         * Claim owner id; a random id is generated when empty.
         */
        private String ownerId = "";
        /**
         * Age after which a processing claim may be taken over. Zero disables reclaiming.
         */
        private Duration processingTimeout = Duration.ofMinutes(15);
        private Duration drainTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public Duration getProcessingTimeout() {
            return processingTimeout;
        }

        public void setProcessingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Watch {
        /**
         * Source tables whose events are claimed. Empty claims every table.
         */
        private List<String> tables = new ArrayList<>(List.of(
            "households",
            "b2c_customers",
            "b2c_customer_health_profiles",
            "b2c_customer_health_conditions",
            "b2c_customer_allergens",
            "b2c_customer_dietary_preferences",
            "household_preferences",
            "household_budgets",
            "vendors",
            "b2b_customers",
            "b2b_customer_health_profiles",
            "b2b_customer_health_conditions",
            "b2b_customer_allergens",
            "b2b_customer_dietary_preferences"));

        /**
         * Aggregate type codes whose events are claimed. Empty claims every type.
         */
        private List<String> aggregateTypes = new ArrayList<>(List.of("b2c_customer", "b2b_customer", "household"));

        public List<String> getTables() {
            return tables;
        }

        public void setTables(List<String> tables) {
            this.tables = tables;
        }

        public List<String> getAggregateTypes() {
            return aggregateTypes;
        }

        public void setAggregateTypes(List<String> aggregateTypes) {
            this.aggregateTypes = aggregateTypes;
        }
    }

    public static class Neo4j {
        /**
         * Target database; the server default when empty.
         */
        private String database;

        /**
         * Create the id uniqueness constraint of every node label at startup.
         */
        private boolean createConstraints = true;

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public boolean isCreateConstraints() {
            return createConstraints;
        }

        public void setCreateConstraints(boolean createConstraints) {
            this.createConstraints = createConstraints;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "graphsync";

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
