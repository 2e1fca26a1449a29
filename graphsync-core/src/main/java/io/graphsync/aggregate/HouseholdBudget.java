package io.graphsync.aggregate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Row of the {@code household_budgets} table.
 */
public record HouseholdBudget(
    String id,
    String budgetType,
    BigDecimal amount,
    String currency,
    String period,
    LocalDate startDate,
    LocalDate endDate,
    Boolean active,
    Instant createdAt
) {
    public HouseholdBudget {
        Objects.requireNonNull(id, "id");
    }
}
