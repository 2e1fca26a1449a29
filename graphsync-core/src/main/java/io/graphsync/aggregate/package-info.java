/**
 * Typed aggregate snapshots and the loader that assembles them from relational rows.
 */
package io.graphsync.aggregate;
