/**
 * Routing of claimed events to per-kind handlers, and tombstone handling.
 */
package io.graphsync.dispatch;
