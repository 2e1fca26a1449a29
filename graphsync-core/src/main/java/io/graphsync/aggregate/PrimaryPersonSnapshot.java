package io.graphsync.aggregate;

import io.graphsync.model.AggregateKind;

import java.util.List;
import java.util.Objects;

/**
 * A B2C customer together with its household and the household's preferences and budgets.
 */
public record PrimaryPersonSnapshot(
    PrimaryPerson person,
    Household household,
    HealthAssociations health,
    List<HouseholdPreference> householdPreferences,
    List<HouseholdBudget> householdBudgets
) implements AggregateSnapshot {

    public PrimaryPersonSnapshot {
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(household, "household");
        Objects.requireNonNull(health, "health");
        householdPreferences = List.copyOf(Objects.requireNonNull(householdPreferences, "householdPreferences"));
        householdBudgets = List.copyOf(Objects.requireNonNull(householdBudgets, "householdBudgets"));
        if (!person.householdId().equals(household.id())) {
            throw new IllegalArgumentException("household " + household.id()
                + " does not match person household " + person.householdId());
        }
    }

    @Override
    public AggregateKind kind() {
        return AggregateKind.PRIMARY_PERSON;
    }

    @Override
    public String id() {
        return person.id();
    }
}
