/**
 * Spring Boot auto-configuration for the graph sync consumer.
 *
 * <p>Adding {@code graphsync-spring-boot-starter} to an application with a
 * {@code spring.datasource.*} and {@code spring.neo4j.*} configuration is enough to run
 * the consumer; see {@link io.graphsync.spring.boot.GraphSyncProperties} for tuning.
 */
package io.graphsync.spring.boot;
