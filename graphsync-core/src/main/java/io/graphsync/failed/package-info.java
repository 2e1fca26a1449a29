/**
 * Inspection and replay of events that exhausted their attempts.
 */
package io.graphsync.failed;
