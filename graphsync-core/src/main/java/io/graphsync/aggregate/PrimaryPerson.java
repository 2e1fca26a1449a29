package io.graphsync.aggregate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Row of the {@code b2c_customers} table.
 */
public record PrimaryPerson(
    String id,
    String householdId,
    String fullName,
    String firstName,
    String lastName,
    String email,
    String phone,
    String householdRole,
    Integer birthYear,
    Integer birthMonth,
    LocalDate dateOfBirth,
    Integer age,
    String gender,
    Boolean profileOwner,
    String accountStatus,
    Instant createdAt,
    Instant updatedAt
) {
    public PrimaryPerson {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(householdId, "householdId");
    }
}
