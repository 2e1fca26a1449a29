package io.graphsync.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone worker that drains the customer outbox into Neo4j.
 *
 * <p>The starter auto-configures the consumer from {@code application.yml}; this class only
 * boots the context and adds the {@code graphsyncfailed} actuator endpoint.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/graphsync-worker/pom.xml spring-boot:run
 */
@SpringBootApplication
public class GraphSyncWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphSyncWorkerApplication.class, args);
    }
}
