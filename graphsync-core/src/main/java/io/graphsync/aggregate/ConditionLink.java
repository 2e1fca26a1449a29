package io.graphsync.aggregate;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A person's health condition: the catalog entry plus the attributes of the association.
 *
 * @param conditionId id of the {@code health_conditions} catalog row
 * @param name        catalog display name (may be {@code null})
 */
public record ConditionLink(
    String conditionId,
    String name,
    String severity,
    LocalDate diagnosisDate,
    Boolean active,
    String notes
) {
    public ConditionLink {
        Objects.requireNonNull(conditionId, "conditionId");
    }
}
