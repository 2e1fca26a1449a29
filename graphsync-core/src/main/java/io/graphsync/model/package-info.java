/**
 * Outbox event model: the persisted row, its status lifecycle, the operation that
 * produced it and the aggregate kinds it can refer to.
 */
package io.graphsync.model;
