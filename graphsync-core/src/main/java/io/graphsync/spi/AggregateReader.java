package io.graphsync.spi;

import io.graphsync.aggregate.AllergenLink;
import io.graphsync.aggregate.BusinessPerson;
import io.graphsync.aggregate.ConditionLink;
import io.graphsync.aggregate.DietLink;
import io.graphsync.aggregate.HealthProfile;
import io.graphsync.aggregate.Household;
import io.graphsync.aggregate.HouseholdBudget;
import io.graphsync.aggregate.HouseholdPreference;
import io.graphsync.aggregate.PersonKind;
import io.graphsync.aggregate.PrimaryPerson;
import io.graphsync.aggregate.Vendor;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the relational rows that make up an aggregate.
 *
 * <p>Every method runs on the caller's connection so that the
 * {@link io.graphsync.aggregate.AggregateLoader} can assemble a snapshot inside one
 * transaction. Implementations throw unchecked exceptions on database errors.
 *
 * @see io.graphsync.jdbc.reader.JdbcAggregateReader
 */
public interface AggregateReader {

    Optional<PrimaryPerson> findPrimaryPerson(Connection conn, String personId);

    Optional<BusinessPerson> findBusinessPerson(Connection conn, String personId);

    Optional<Household> findHousehold(Connection conn, String householdId);

    Optional<Vendor> findVendor(Connection conn, String vendorId);

    Optional<HealthProfile> findHealthProfile(Connection conn, PersonKind kind, String personId);

    List<ConditionLink> findConditions(Connection conn, PersonKind kind, String personId);

    List<AllergenLink> findAllergens(Connection conn, PersonKind kind, String personId);

    List<DietLink> findDiets(Connection conn, PersonKind kind, String personId);

    List<HouseholdPreference> findHouseholdPreferences(Connection conn, String householdId);

    List<HouseholdBudget> findHouseholdBudgets(Connection conn, String householdId);
}
