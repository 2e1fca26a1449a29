package io.graphsync.aggregate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Row of the {@code b2b_customers} table.
 */
public record BusinessPerson(
    String id,
    String vendorId,
    String fullName,
    String email,
    String phone,
    String externalId,
    String accountStatus,
    LocalDate dateOfBirth,
    String gender,
    Instant createdAt,
    Instant updatedAt
) {
    public BusinessPerson {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vendorId, "vendorId");
    }
}
