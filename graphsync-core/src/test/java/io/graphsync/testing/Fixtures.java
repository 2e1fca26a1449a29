package io.graphsync.testing;

import io.graphsync.aggregate.AllergenLink;
import io.graphsync.aggregate.BusinessPerson;
import io.graphsync.aggregate.ConditionLink;
import io.graphsync.aggregate.DietLink;
import io.graphsync.aggregate.HealthProfile;
import io.graphsync.aggregate.Household;
import io.graphsync.aggregate.HouseholdBudget;
import io.graphsync.aggregate.HouseholdPreference;
import io.graphsync.aggregate.PrimaryPerson;
import io.graphsync.aggregate.Vendor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Sample rows shared by projection, loader and consumer tests.
 */
public final class Fixtures {
  public static final Instant CREATED = Instant.parse("2024-03-01T10:15:30Z");
  public static final Instant UPDATED = Instant.parse("2024-04-02T08:00:00Z");

  private Fixtures() {
  }

  public static Household household(String id) {
    return new Household(id, "The Smiths", "family", "active", 3,
        "US", "CA", "San Diego", "92101", CREATED, UPDATED);
  }

  public static PrimaryPerson primaryPerson(String id, String householdId) {
    return new PrimaryPerson(id, householdId, "Alex Smith", "Alex", "Smith", "alex@example.com",
        null, "primary_adult", 1985, 6, LocalDate.of(1985, 6, 14), 38, "female", true, "active",
        CREATED, UPDATED);
  }

  public static Vendor vendor(String id) {
    return new Vendor(id, "Acme Clinics", "clinic", "acme-clinics");
  }

  public static BusinessPerson businessPerson(String id, String vendorId) {
    return new BusinessPerson(id, vendorId, "Sam Lee", "sam@example.com", "+1-555-0100", "EXT-42",
        "active", LocalDate.of(1990, 1, 2), "male", CREATED, UPDATED);
  }

  public static HealthProfile profile(String id) {
    return new HealthProfile(id, 170.0, 68.5, 23.7, 1450.0, 2100.0, "moderate", "maintain",
        66.0, 2000, 120.0, 250.0, 70.0, 30.0, 2300.0, 50.0, CREATED, UPDATED);
  }

  public static ConditionLink condition(String id, String name) {
    return new ConditionLink(id, name, "moderate", LocalDate.of(2020, 5, 1), true, null);
  }

  public static AllergenLink allergen(String id, String name) {
    return new AllergenLink(id, name, "severe", null, true, "hives");
  }

  public static DietLink diet(String id, String name) {
    return new DietLink(id, name, "strict", LocalDate.of(2022, 1, 1), true);
  }

  public static HouseholdPreference preference(String id, String type, String value) {
    return new HouseholdPreference(id, type, value, 1, CREATED);
  }

  public static HouseholdBudget budget(String id, String amount) {
    return new HouseholdBudget(id, "grocery", new BigDecimal(amount), "USD", "weekly",
        LocalDate.of(2024, 1, 1), null, true, CREATED);
  }
}
