package io.graphsync.aggregate;

import java.time.Instant;
import java.util.Objects;

/**
 * Row of the {@code household_preferences} table.
 */
public record HouseholdPreference(
    String id,
    String preferenceType,
    String preferenceValue,
    Integer priority,
    Instant createdAt
) {
    public HouseholdPreference {
        Objects.requireNonNull(id, "id");
    }
}
