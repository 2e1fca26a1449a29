package io.graphsync.jdbc;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Inserts source rows for reader and end-to-end tests.
 */
public final class SeedData {
  public static final Instant CREATED = Instant.parse("2024-03-01T10:15:30Z");

  private final DataSource dataSource;

  public SeedData(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  public SeedData household(String id, String name) {
    TestDatabases.execute(dataSource,
        "INSERT INTO households (id, household_name, household_type, account_status, total_members,"
            + " location_country, location_region, location_city, location_postal_code, created_at, updated_at)"
            + " VALUES (?,?,?,?,?,?,?,?,?,?,?)",
        id, name, "family", "active", 3, "US", "CA", "San Diego", "92101", ts(CREATED), ts(CREATED));
    return this;
  }

  public SeedData primaryPerson(String id, String householdId, String fullName) {
    TestDatabases.execute(dataSource,
        "INSERT INTO b2c_customers (id, household_id, full_name, first_name, last_name, email, household_role,"
            + " birth_year, birth_month, date_of_birth, age, gender, is_profile_owner, account_status,"
            + " created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        id, householdId, fullName, "Alex", "Smith", "alex@example.com", "primary_adult",
        1985, 6, LocalDate.of(1985, 6, 14), 38, "female", true, "active", ts(CREATED), ts(CREATED));
    return this;
  }

  public SeedData vendor(String id, String name) {
    TestDatabases.execute(dataSource,
        "INSERT INTO vendors (id, name, vendor_type, slug) VALUES (?,?,?,?)",
        id, name, "clinic", "acme-clinics");
    return this;
  }

  public SeedData businessPerson(String id, String vendorId, String fullName) {
    TestDatabases.execute(dataSource,
        "INSERT INTO b2b_customers (id, vendor_id, full_name, email, external_id, account_status,"
            + " gender, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?)",
        id, vendorId, fullName, "sam@example.com", "EXT-42", "active", "male", ts(CREATED), ts(CREATED));
    return this;
  }

  /** Health profile for a person of the given table family ({@code b2c_customer} or {@code b2b_customer}). */
  public SeedData profile(String family, String id, String personId, double weightKg) {
    TestDatabases.execute(dataSource,
        "INSERT INTO " + family + "_health_profiles (id, " + family + "_id, height_cm, weight_kg,"
            + " activity_level, health_goal, target_calories, created_at, updated_at)"
            + " VALUES (?,?,?,?,?,?,?,?,?)",
        id, personId, 170.0, weightKg, "moderate", "maintain", 2000, ts(CREATED), ts(CREATED));
    return this;
  }

  public SeedData catalog(String table, String id, String name) {
    TestDatabases.execute(dataSource, "INSERT INTO " + table + " (id, name) VALUES (?,?)", id, name);
    return this;
  }

  public SeedData condition(String family, String personId, String conditionId, String severity) {
    TestDatabases.execute(dataSource,
        "INSERT INTO " + family + "_health_conditions (" + family + "_id, condition_id, severity,"
            + " diagnosis_date, is_active, notes) VALUES (?,?,?,?,?,?)",
        personId, conditionId, severity, LocalDate.of(2020, 5, 1), true, null);
    return this;
  }

  public SeedData allergen(String family, String personId, String allergenId) {
    TestDatabases.execute(dataSource,
        "INSERT INTO " + family + "_allergens (" + family + "_id, allergen_id, severity, is_active,"
            + " reaction_description) VALUES (?,?,?,?,?)",
        personId, allergenId, "severe", true, "hives");
    return this;
  }

  public SeedData diet(String family, String personId, String dietId) {
    TestDatabases.execute(dataSource,
        "INSERT INTO " + family + "_dietary_preferences (" + family + "_id, diet_id, strictness, start_date,"
            + " is_active) VALUES (?,?,?,?,?)",
        personId, dietId, "strict", LocalDate.of(2022, 1, 1), true);
    return this;
  }

  public SeedData preference(String id, String householdId, String type, String value) {
    TestDatabases.execute(dataSource,
        "INSERT INTO household_preferences (id, household_id, preference_type, preference_value, priority,"
            + " created_at) VALUES (?,?,?,?,?,?)",
        id, householdId, type, value, 1, ts(CREATED));
    return this;
  }

  public SeedData budget(String id, String householdId, String amount) {
    TestDatabases.execute(dataSource,
        "INSERT INTO household_budgets (id, household_id, budget_type, amount, currency, period, start_date,"
            + " is_active, created_at) VALUES (?,?,?,?,?,?,?,?,?)",
        id, householdId, "grocery", new BigDecimal(amount), "USD", "weekly", LocalDate.of(2024, 1, 1), true,
        ts(CREATED));
    return this;
  }

  private static Timestamp ts(Instant instant) {
    return Timestamp.from(instant);
  }
}
