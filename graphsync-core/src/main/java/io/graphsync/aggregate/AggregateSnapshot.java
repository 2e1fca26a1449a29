package io.graphsync.aggregate;

import io.graphsync.model.AggregateKind;

/**
 * Immutable, fully assembled state of one aggregate, read once per event.
 *
 * <p>One variant per {@link AggregateKind}. A snapshot is owned by the processing of a
 * single event and discarded afterwards.
 */
public sealed interface AggregateSnapshot
    permits PrimaryPersonSnapshot, BusinessPersonSnapshot, GroupSnapshot {

    AggregateKind kind();

    /**
     * Id of the aggregate root.
     */
    String id();
}
