package io.graphsync.aggregate;

import java.util.List;
import java.util.Objects;

/**
 * Health data attached to a person: optional profile and the three association sets.
 *
 * @param profile the health profile, or {@code null} if the person has none
 */
public record HealthAssociations(
    HealthProfile profile,
    List<ConditionLink> conditions,
    List<AllergenLink> allergens,
    List<DietLink> diets
) {
    public HealthAssociations {
        conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
        allergens = List.copyOf(Objects.requireNonNull(allergens, "allergens"));
        diets = List.copyOf(Objects.requireNonNull(diets, "diets"));
    }

    public static HealthAssociations none() {
        return new HealthAssociations(null, List.of(), List.of(), List.of());
    }
}
