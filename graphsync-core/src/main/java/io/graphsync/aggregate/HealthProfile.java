package io.graphsync.aggregate;

import java.time.Instant;
import java.util.Objects;

/**
 * Health profile of a person, at most one per person. Shared shape of
 * {@code b2c_customer_health_profiles} and {@code b2b_customer_health_profiles}.
 */
public record HealthProfile(
    String id,
    Double heightCm,
    Double weightKg,
    Double bmi,
    Double bmr,
    Double tdee,
    String activityLevel,
    String healthGoal,
    Double targetWeightKg,
    Integer targetCalories,
    Double targetProteinG,
    Double targetCarbsG,
    Double targetFatG,
    Double targetFiberG,
    Double targetSodiumMg,
    Double targetSugarG,
    Instant createdAt,
    Instant updatedAt
) {
    public HealthProfile {
        Objects.requireNonNull(id, "id");
    }
}
