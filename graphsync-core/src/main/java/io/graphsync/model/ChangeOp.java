package io.graphsync.model;

import java.util.Locale;

/**
 * Relational operation that produced an outbox event.
 */
public enum ChangeOp {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses an operation code case-insensitively.
     *
     * <p>Only {@code DELETE} changes how an event is handled, so unrecognized codes map to
     * {@link #UPDATE} and take the upsert path.
     *
     * @param code the stored operation code (may be {@code null})
     * @return the parsed operation
     */
    public static ChangeOp fromCode(String code) {
        if (code == null) {
            return UPDATE;
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "INSERT" -> INSERT;
            case "DELETE" -> DELETE;
            default -> UPDATE;
        };
    }
}
