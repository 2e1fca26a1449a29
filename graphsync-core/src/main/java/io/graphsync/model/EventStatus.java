package io.graphsync.model;

/**
 * Lifecycle status of an outbox event row.
 *
 * <p>Transitions: PENDING → PROCESSING on claim; PROCESSING → PROCESSED on success;
 * PROCESSING → PENDING on a retryable failure; PROCESSING → FAILED once the event has
 * been claimed {@code maxAttempts} times.
 */
public enum EventStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    FAILED("failed");

    private final String code;

    EventStatus(String code) {
        this.code = code;
    }

    /**
     * Value stored in the {@code status} column.
     */
    public String code() {
        return code;
    }

    public static EventStatus fromCode(String code) {
        for (EventStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown event status: " + code);
    }
}
