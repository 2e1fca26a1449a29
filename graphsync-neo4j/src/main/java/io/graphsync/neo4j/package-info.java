/**
 * Neo4j implementation of {@link io.graphsync.spi.GraphWriter}.
 */
package io.graphsync.neo4j;
