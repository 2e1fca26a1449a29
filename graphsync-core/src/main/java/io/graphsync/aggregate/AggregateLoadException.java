package io.graphsync.aggregate;

import io.graphsync.model.AggregateKind;

/**
 * Unchecked exception raised when an aggregate cannot be read from the relational store.
 */
public final class AggregateLoadException extends RuntimeException {
    private final AggregateKind kind;
    private final String aggregateId;

    public AggregateLoadException(AggregateKind kind, String aggregateId, Throwable cause) {
        super("Failed to load " + kind.code() + " " + aggregateId, cause);
        this.kind = kind;
        this.aggregateId = aggregateId;
    }

    public AggregateKind kind() {
        return kind;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
