package io.graphsync.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The aggregate kinds projected into the graph, keyed by the code the upstream write
 * path stores in {@code aggregate_type}.
 */
public enum AggregateKind {
    /** Household member (B2C customer). */
    PRIMARY_PERSON("b2c_customer"),
    /** Customer managed by a vendor (B2B customer). */
    BUSINESS_PERSON("b2b_customer"),
    /** Household grouping several primary persons. */
    GROUP("household");

    private final String code;

    AggregateKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves an {@code aggregate_type} code case-insensitively.
     *
     * @param code the stored aggregate type (may be {@code null})
     * @return the matching kind, or empty if the code is not projected
     */
    public static Optional<AggregateKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AggregateKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
