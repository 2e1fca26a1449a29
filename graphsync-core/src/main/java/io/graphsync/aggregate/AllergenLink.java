package io.graphsync.aggregate;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A person's allergen: the catalog entry plus the attributes of the association.
 *
 * @param allergenId id of the {@code allergens} catalog row
 * @param name       catalog display name (may be {@code null})
 */
public record AllergenLink(
    String allergenId,
    String name,
    String severity,
    LocalDate diagnosisDate,
    Boolean active,
    String reactionDescription
) {
    public AllergenLink {
        Objects.requireNonNull(allergenId, "allergenId");
    }
}
