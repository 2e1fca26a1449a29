package io.graphsync.aggregate;

import io.graphsync.model.AggregateKind;

import java.util.List;
import java.util.Objects;

/**
 * A household with its preferences and budgets.
 */
public record GroupSnapshot(
    Household household,
    List<HouseholdPreference> preferences,
    List<HouseholdBudget> budgets
) implements AggregateSnapshot {

    public GroupSnapshot {
        Objects.requireNonNull(household, "household");
        preferences = List.copyOf(Objects.requireNonNull(preferences, "preferences"));
        budgets = List.copyOf(Objects.requireNonNull(budgets, "budgets"));
    }

    @Override
    public AggregateKind kind() {
        return AggregateKind.GROUP;
    }

    @Override
    public String id() {
        return household.id();
    }
}
