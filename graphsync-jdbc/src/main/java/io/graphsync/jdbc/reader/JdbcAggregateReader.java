package io.graphsync.jdbc.reader;

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
import io.graphsync.jdbc.JdbcTemplate;
import io.graphsync.spi.AggregateReader;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

import static io.graphsync.jdbc.reader.JdbcRows.*;

/**
 * {@link AggregateReader} over the customer and household tables.
 *
 * <p>B2C and B2B health data live in parallel table families
 * ({@code b2c_customer_*} / {@code b2b_customer_*}) with the same shape; {@link PersonKind}
 * selects the family. Catalog names come from {@code health_conditions}, {@code allergens}
 * and {@code dietary_preferences}. Collections are returned in a stable order (by catalog
 * or row id).
 *
 * <p>Ids are bound as strings. On PostgreSQL with {@code uuid} keys, connect with
 * {@code stringtype=unspecified} so the server casts them.
 */
public final class JdbcAggregateReader implements AggregateReader {

    private static final String PRIMARY_PERSON_SQL =
        "SELECT id, household_id, full_name, first_name, last_name, email, phone, household_role," +
        " birth_year, birth_month, date_of_birth, age, gender, is_profile_owner, account_status," +
        " created_at, updated_at" +
        " FROM b2c_customers WHERE id = ?";

    private static final String BUSINESS_PERSON_SQL =
        "SELECT id, vendor_id, full_name, email, phone, external_id, account_status, date_of_birth," +
        " gender, created_at, updated_at" +
        " FROM b2b_customers WHERE id = ?";

    private static final String HOUSEHOLD_SQL =
        "SELECT id, household_name, household_type, account_status, total_members," +
        " location_country, location_region, location_city, location_postal_code," +
        " created_at, updated_at" +
        " FROM households WHERE id = ?";

    private static final String VENDOR_SQL =
        "SELECT id, name, vendor_type, slug FROM vendors WHERE id = ?";

    private static final String PREFERENCES_SQL =
        "SELECT id, preference_type, preference_value, priority, created_at" +
        " FROM household_preferences WHERE household_id = ? ORDER BY id";

    private static final String BUDGETS_SQL =
        "SELECT id, budget_type, amount, currency, period, start_date, end_date, is_active, created_at" +
        " FROM household_budgets WHERE household_id = ? ORDER BY id";

    private static final JdbcTemplate.RowMapper<PrimaryPerson> PRIMARY_PERSON_MAPPER = rs -> new PrimaryPerson(
        rs.getString("id"),
        rs.getString("household_id"),
        rs.getString("full_name"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("household_role"),
        getInteger(rs, "birth_year"),
        getInteger(rs, "birth_month"),
        getLocalDate(rs, "date_of_birth"),
        getInteger(rs, "age"),
        rs.getString("gender"),
        getBoolean(rs, "is_profile_owner"),
        rs.getString("account_status"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));

    private static final JdbcTemplate.RowMapper<BusinessPerson> BUSINESS_PERSON_MAPPER = rs -> new BusinessPerson(
        rs.getString("id"),
        rs.getString("vendor_id"),
        rs.getString("full_name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("external_id"),
        rs.getString("account_status"),
        getLocalDate(rs, "date_of_birth"),
        rs.getString("gender"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));

    private static final JdbcTemplate.RowMapper<Household> HOUSEHOLD_MAPPER = rs -> new Household(
        rs.getString("id"),
        rs.getString("household_name"),
        rs.getString("household_type"),
        rs.getString("account_status"),
        getInteger(rs, "total_members"),
        rs.getString("location_country"),
        rs.getString("location_region"),
        rs.getString("location_city"),
        rs.getString("location_postal_code"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));

    private static final JdbcTemplate.RowMapper<Vendor> VENDOR_MAPPER = rs -> new Vendor(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("vendor_type"),
        rs.getString("slug"));

    private static final JdbcTemplate.RowMapper<HealthProfile> PROFILE_MAPPER = rs -> new HealthProfile(
        rs.getString("id"),
        getDouble(rs, "height_cm"),
        getDouble(rs, "weight_kg"),
        getDouble(rs, "bmi"),
        getDouble(rs, "bmr"),
        getDouble(rs, "tdee"),
        rs.getString("activity_level"),
        rs.getString("health_goal"),
        getDouble(rs, "target_weight_kg"),
        getInteger(rs, "target_calories"),
        getDouble(rs, "target_protein_g"),
        getDouble(rs, "target_carbs_g"),
        getDouble(rs, "target_fat_g"),
        getDouble(rs, "target_fiber_g"),
        getDouble(rs, "target_sodium_mg"),
        getDouble(rs, "target_sugar_g"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));

    private static final JdbcTemplate.RowMapper<ConditionLink> CONDITION_MAPPER = rs -> new ConditionLink(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("severity"),
        getLocalDate(rs, "diagnosis_date"),
        getBoolean(rs, "is_active"),
        rs.getString("notes"));

    private static final JdbcTemplate.RowMapper<AllergenLink> ALLERGEN_MAPPER = rs -> new AllergenLink(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("severity"),
        getLocalDate(rs, "diagnosis_date"),
        getBoolean(rs, "is_active"),
        rs.getString("reaction_description"));

    private static final JdbcTemplate.RowMapper<DietLink> DIET_MAPPER = rs -> new DietLink(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("strictness"),
        getLocalDate(rs, "start_date"),
        getBoolean(rs, "is_active"));

    private static final JdbcTemplate.RowMapper<HouseholdPreference> PREFERENCE_MAPPER = rs -> new HouseholdPreference(
        rs.getString("id"),
        rs.getString("preference_type"),
        rs.getString("preference_value"),
        getInteger(rs, "priority"),
        getInstant(rs, "created_at"));

    private static final JdbcTemplate.RowMapper<HouseholdBudget> BUDGET_MAPPER = rs -> new HouseholdBudget(
        rs.getString("id"),
        rs.getString("budget_type"),
        getBigDecimal(rs, "amount"),
        rs.getString("currency"),
        rs.getString("period"),
        getLocalDate(rs, "start_date"),
        getLocalDate(rs, "end_date"),
        getBoolean(rs, "is_active"),
        getInstant(rs, "created_at"));

    @Override
    public Optional<PrimaryPerson> findPrimaryPerson(Connection conn, String personId) {
        return JdbcTemplate.queryOne(conn, PRIMARY_PERSON_SQL, PRIMARY_PERSON_MAPPER, personId);
    }

    @Override
    public Optional<BusinessPerson> findBusinessPerson(Connection conn, String personId) {
        return JdbcTemplate.queryOne(conn, BUSINESS_PERSON_SQL, BUSINESS_PERSON_MAPPER, personId);
    }

    @Override
    public Optional<Household> findHousehold(Connection conn, String householdId) {
        return JdbcTemplate.queryOne(conn, HOUSEHOLD_SQL, HOUSEHOLD_MAPPER, householdId);
    }

    @Override
    public Optional<Vendor> findVendor(Connection conn, String vendorId) {
        return JdbcTemplate.queryOne(conn, VENDOR_SQL, VENDOR_MAPPER, vendorId);
    }

    @Override
    public Optional<HealthProfile> findHealthProfile(Connection conn, PersonKind kind, String personId) {
        String sql = "SELECT id, height_cm, weight_kg, bmi, bmr, tdee, activity_level, health_goal," +
            " target_weight_kg, target_calories, target_protein_g, target_carbs_g, target_fat_g," +
            " target_fiber_g, target_sodium_mg, target_sugar_g, created_at, updated_at" +
            " FROM " + family(kind) + "_health_profiles WHERE " + ownerColumn(kind) + " = ?";
        return JdbcTemplate.queryOne(conn, sql, PROFILE_MAPPER, personId);
    }

    @Override
    public List<ConditionLink> findConditions(Connection conn, PersonKind kind, String personId) {
        String sql = "SELECT ch.condition_id AS id, hc.name, ch.severity, ch.diagnosis_date, ch.is_active, ch.notes" +
            " FROM " + family(kind) + "_health_conditions ch" +
            " JOIN health_conditions hc ON hc.id = ch.condition_id" +
            " WHERE ch." + ownerColumn(kind) + " = ? ORDER BY ch.condition_id";
        return JdbcTemplate.query(conn, sql, CONDITION_MAPPER, personId);
    }

    @Override
    public List<AllergenLink> findAllergens(Connection conn, PersonKind kind, String personId) {
        String sql = "SELECT ca.allergen_id AS id, a.name, ca.severity, ca.diagnosis_date, ca.is_active," +
            " ca.reaction_description" +
            " FROM " + family(kind) + "_allergens ca" +
            " JOIN allergens a ON a.id = ca.allergen_id" +
            " WHERE ca." + ownerColumn(kind) + " = ? ORDER BY ca.allergen_id";
        return JdbcTemplate.query(conn, sql, ALLERGEN_MAPPER, personId);
    }

    @Override
    public List<DietLink> findDiets(Connection conn, PersonKind kind, String personId) {
        String sql = "SELECT dp.diet_id AS id, d.name, dp.strictness, dp.start_date, dp.is_active" +
            " FROM " + family(kind) + "_dietary_preferences dp" +
            " JOIN dietary_preferences d ON d.id = dp.diet_id" +
            " WHERE dp." + ownerColumn(kind) + " = ? ORDER BY dp.diet_id";
        return JdbcTemplate.query(conn, sql, DIET_MAPPER, personId);
    }

    @Override
    public List<HouseholdPreference> findHouseholdPreferences(Connection conn, String householdId) {
        return JdbcTemplate.query(conn, PREFERENCES_SQL, PREFERENCE_MAPPER, householdId);
    }

    @Override
    public List<HouseholdBudget> findHouseholdBudgets(Connection conn, String householdId) {
        return JdbcTemplate.query(conn, BUDGETS_SQL, BUDGET_MAPPER, householdId);
    }

    private static String family(PersonKind kind) {
        return switch (kind) {
            case PRIMARY -> "b2c_customer";
            case BUSINESS -> "b2b_customer";
        };
    }

    private static String ownerColumn(PersonKind kind) {
        return family(kind) + "_id";
    }
}
