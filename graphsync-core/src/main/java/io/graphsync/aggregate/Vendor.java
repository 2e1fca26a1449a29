package io.graphsync.aggregate;

import java.util.Objects;

/**
 * Row of the {@code vendors} table; the grouping entity of a business person.
 */
public record Vendor(String id, String name, String vendorType, String slug) {
    public Vendor {
        Objects.requireNonNull(id, "id");
    }
}
