package io.graphsync.aggregate;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A dietary preference followed by a person.
 *
 * @param dietId id of the {@code dietary_preferences} catalog row
 * @param name   catalog display name (may be {@code null})
 */
public record DietLink(
    String dietId,
    String name,
    String strictness,
    LocalDate startDate,
    Boolean active
) {
    public DietLink {
        Objects.requireNonNull(dietId, "dietId");
    }
}
