package io.graphsync.aggregate;

import io.graphsync.model.AggregateKind;
import io.graphsync.spi.AggregateReader;
import io.graphsync.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles {@link AggregateSnapshot}s from relational rows.
 *
 * <p>Each {@link #load} opens one connection and reads the root row, then its dependent
 * rows, inside a single read-only transaction so the snapshot is internally consistent.
 * Dependent sets are only read when the root row exists. Nothing is cached: a household
 * shared by several persons is read again for every load.
 *
 * <p>A person whose household or vendor row is missing is reported as not found.
 */
public final class AggregateLoader {
    private final ConnectionProvider connectionProvider;
    private final AggregateReader reader;

    public AggregateLoader(ConnectionProvider connectionProvider, AggregateReader reader) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Loads the current state of an aggregate.
     *
     * @param kind        aggregate kind
     * @param aggregateId id of the aggregate root
     * @return the snapshot, or empty if the root row does not exist
     * @throws AggregateLoadException if the relational read fails
     */
    public Optional<AggregateSnapshot> load(AggregateKind kind, String aggregateId) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(aggregateId, "aggregateId");
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setReadOnly(true);
            conn.setAutoCommit(false);
            try {
                Optional<AggregateSnapshot> snapshot = read(conn, kind, aggregateId);
                conn.commit();
                return snapshot;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setReadOnly(false);
            }
        } catch (SQLException | RuntimeException e) {
            throw new AggregateLoadException(kind, aggregateId, e);
        }
    }

    private Optional<AggregateSnapshot> read(Connection conn, AggregateKind kind, String id) {
        return switch (kind) {
            case PRIMARY_PERSON -> readPrimaryPerson(conn, id);
            case BUSINESS_PERSON -> readBusinessPerson(conn, id);
            case GROUP -> readGroup(conn, id);
        };
    }

    private Optional<AggregateSnapshot> readPrimaryPerson(Connection conn, String id) {
        Optional<PrimaryPerson> person = reader.findPrimaryPerson(conn, id);
        if (person.isEmpty()) {
            return Optional.empty();
        }
        Optional<Household> household = reader.findHousehold(conn, person.get().householdId());
        if (household.isEmpty()) {
            return Optional.empty();
        }
        String householdId = household.get().id();
        return Optional.of(new PrimaryPersonSnapshot(
            person.get(),
            household.get(),
            readHealth(conn, PersonKind.PRIMARY, id),
            reader.findHouseholdPreferences(conn, householdId),
            reader.findHouseholdBudgets(conn, householdId)));
    }

    private Optional<AggregateSnapshot> readBusinessPerson(Connection conn, String id) {
        Optional<BusinessPerson> person = reader.findBusinessPerson(conn, id);
        if (person.isEmpty()) {
            return Optional.empty();
        }
        Optional<Vendor> vendor = reader.findVendor(conn, person.get().vendorId());
        if (vendor.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BusinessPersonSnapshot(
            person.get(), vendor.get(), readHealth(conn, PersonKind.BUSINESS, id)));
    }

    private Optional<AggregateSnapshot> readGroup(Connection conn, String id) {
        Optional<Household> household = reader.findHousehold(conn, id);
        if (household.isEmpty()) {
            return Optional.empty();
        }
        List<HouseholdPreference> preferences = reader.findHouseholdPreferences(conn, id);
        List<HouseholdBudget> budgets = reader.findHouseholdBudgets(conn, id);
        return Optional.of(new GroupSnapshot(household.get(), preferences, budgets));
    }

    private HealthAssociations readHealth(Connection conn, PersonKind kind, String personId) {
        return new HealthAssociations(
            reader.findHealthProfile(conn, kind, personId).orElse(null),
            reader.findConditions(conn, kind, personId),
            reader.findAllergens(conn, kind, personId),
            reader.findDiets(conn, kind, personId));
    }
}
