package io.graphsync.aggregate;

import io.graphsync.model.AggregateKind;

import java.util.Objects;

/**
 * A B2B customer together with its vendor.
 */
public record BusinessPersonSnapshot(
    BusinessPerson person,
    Vendor vendor,
    HealthAssociations health
) implements AggregateSnapshot {

    public BusinessPersonSnapshot {
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(health, "health");
        if (!person.vendorId().equals(vendor.id())) {
            throw new IllegalArgumentException("vendor " + vendor.id()
                + " does not match person vendor " + person.vendorId());
        }
    }

    @Override
    public AggregateKind kind() {
        return AggregateKind.BUSINESS_PERSON;
    }

    @Override
    public String id() {
        return person.id();
    }
}
