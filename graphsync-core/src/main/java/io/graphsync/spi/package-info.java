/**
 * Service provider interfaces implemented by storage adapters: the outbox table, the
 * relational rows of an aggregate, the graph store, and metrics backends.
 */
package io.graphsync.spi;
