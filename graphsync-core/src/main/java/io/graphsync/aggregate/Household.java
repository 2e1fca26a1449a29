package io.graphsync.aggregate;

import java.time.Instant;
import java.util.Objects;

/**
 * Row of the {@code households} table.
 */
public record Household(
    String id,
    String name,
    String type,
    String accountStatus,
    Integer totalMembers,
    String locationCountry,
    String locationRegion,
    String locationCity,
    String locationPostalCode,
    Instant createdAt,
    Instant updatedAt
) {
    public Household {
        Objects.requireNonNull(id, "id");
    }
}
