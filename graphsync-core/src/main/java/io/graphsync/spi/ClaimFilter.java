package io.graphsync.spi;

import java.util.Objects;
import java.util.Set;

/**
 * Eligibility filter applied by {@link OutboxStore#claimPending}.
 *
 * @param maxAttempts    events already claimed this many times are never claimed again
 * @param tableNames     watched source tables; empty means no table filter
 * @param aggregateTypes watched aggregate type codes; empty means no type filter
 */
public record ClaimFilter(int maxAttempts, Set<String> tableNames, Set<String> aggregateTypes) {

    public ClaimFilter {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        tableNames = Set.copyOf(Objects.requireNonNull(tableNames, "tableNames"));
        aggregateTypes = Set.copyOf(Objects.requireNonNull(aggregateTypes, "aggregateTypes"));
    }

    public static ClaimFilter unfiltered(int maxAttempts) {
        return new ClaimFilter(maxAttempts, Set.of(), Set.of());
    }
}
