package io.graphsync.projection;

import io.graphsync.aggregate.AggregateSnapshot;
import io.graphsync.aggregate.AllergenLink;
import io.graphsync.aggregate.BusinessPerson;
import io.graphsync.aggregate.BusinessPersonSnapshot;
import io.graphsync.aggregate.ConditionLink;
import io.graphsync.aggregate.DietLink;
import io.graphsync.aggregate.GroupSnapshot;
import io.graphsync.aggregate.HealthAssociations;
import io.graphsync.aggregate.HealthProfile;
import io.graphsync.aggregate.Household;
import io.graphsync.aggregate.HouseholdBudget;
import io.graphsync.aggregate.HouseholdPreference;
import io.graphsync.aggregate.PrimaryPerson;
import io.graphsync.aggregate.PrimaryPersonSnapshot;
import io.graphsync.aggregate.Vendor;
import io.graphsync.spi.GraphWriter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates aggregate snapshots into {@link GraphDocument}s and writes them through a
 * {@link GraphWriter}.
 *
 * <p>Each snapshot variant has a fixed projection shape:
 * <ul>
 *   <li>primary person: {@code B2CCustomer} belonging to a {@code Household}, with profile,
 *       conditions, allergens and diets; the household's preferences and budgets are
 *       replaced as well.
 *   <li>business person: {@code B2BCustomer} belonging to a {@code Vendor}, with profile,
 *       conditions, allergens and diets.
 *   <li>group: {@code Household} with its preferences and budgets.
 * </ul>
 *
 * <p>Catalog nodes (conditions, allergens, diets, vendors) use
 * {@link MergeMode#KEEP_EXISTING}; owned nodes and the primary node are overwritten.
 * Timestamps are written as UTC date-times and monetary amounts as doubles.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class GraphProjector {
    private static final Logger logger = Logger.getLogger(GraphProjector.class.getName());

    private final GraphWriter graphWriter;

    public GraphProjector(GraphWriter graphWriter) {
        this.graphWriter = Objects.requireNonNull(graphWriter, "graphWriter");
    }

    /**
     * Projects a snapshot in one graph transaction.
     *
     * @param snapshot the assembled aggregate
     * @throws GraphWriteException if the graph transaction fails
     */
    public void project(AggregateSnapshot snapshot) {
        GraphDocument document = toDocument(snapshot);
        graphWriter.upsert(document);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Projected " + snapshot.kind().code() + " id=" + snapshot.id()
                + " " + describe(document.relationships()));
        }
    }

    /**
     * Builds the projection document for a snapshot without writing it.
     */
    public GraphDocument toDocument(AggregateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot instanceof PrimaryPersonSnapshot primary) {
            return primaryPersonDocument(primary);
        }
        if (snapshot instanceof BusinessPersonSnapshot business) {
            return businessPersonDocument(business);
        }
        if (snapshot instanceof GroupSnapshot group) {
            return groupDocument(group);
        }
        throw new IllegalArgumentException("Unsupported snapshot: " + snapshot.getClass().getName());
    }

    private GraphDocument primaryPersonDocument(PrimaryPersonSnapshot snapshot) {
        PrimaryPerson person = snapshot.person();
        Household household = snapshot.household();

        List<RelationshipSet> sets = new ArrayList<>();
        sets.add(profileSet(NodeLabel.B2C_CUSTOMER, person.id(),
            NodeLabel.B2C_HEALTH_PROFILE, snapshot.health().profile()));
        sets.addAll(healthSets(NodeLabel.B2C_CUSTOMER, person.id(), snapshot.health()));
        sets.add(preferenceSet(household.id(), snapshot.householdPreferences()));
        sets.add(budgetSet(household.id(), snapshot.householdBudgets()));

        return new GraphDocument(
            new GraphNode(NodeLabel.B2C_CUSTOMER, person.id(), primaryPersonProperties(person)),
            new ParentLink(householdNode(household), RelationshipType.BELONGS_TO_HOUSEHOLD, MergeMode.OVERWRITE),
            sets);
    }

    private GraphDocument businessPersonDocument(BusinessPersonSnapshot snapshot) {
        BusinessPerson person = snapshot.person();

        List<RelationshipSet> sets = new ArrayList<>();
        sets.add(profileSet(NodeLabel.B2B_CUSTOMER, person.id(),
            NodeLabel.B2B_HEALTH_PROFILE, snapshot.health().profile()));
        sets.addAll(healthSets(NodeLabel.B2B_CUSTOMER, person.id(), snapshot.health()));

        return new GraphDocument(
            new GraphNode(NodeLabel.B2B_CUSTOMER, person.id(), businessPersonProperties(person)),
            new ParentLink(vendorNode(snapshot.vendor()), RelationshipType.BELONGS_TO_VENDOR, MergeMode.KEEP_EXISTING),
            sets);
    }

    private GraphDocument groupDocument(GroupSnapshot snapshot) {
        Household household = snapshot.household();
        return new GraphDocument(
            householdNode(household),
            null,
            List.of(preferenceSet(household.id(), snapshot.preferences()),
                budgetSet(household.id(), snapshot.budgets())));
    }

    private static RelationshipSet profileSet(NodeLabel ownerLabel, String ownerId,
                                              NodeLabel profileLabel, HealthProfile profile) {
        List<GraphEdge> edges = profile == null
            ? List.of()
            : List.of(new GraphEdge(new GraphNode(profileLabel, profile.id(), profileProperties(profile)), Map.of()));
        return new RelationshipSet(ownerLabel, ownerId, RelationshipType.HAS_PROFILE,
            profileLabel, MergeMode.OVERWRITE, edges);
    }

    private static List<RelationshipSet> healthSets(NodeLabel ownerLabel, String ownerId, HealthAssociations health) {
        List<GraphEdge> conditions = new ArrayList<>();
        for (ConditionLink link : health.conditions()) {
            Map<String, Object> rel = new LinkedHashMap<>();
            rel.put("severity", link.severity());
            rel.put("diagnosis_date", link.diagnosisDate());
            rel.put("is_active", link.active());
            rel.put("notes", link.notes());
            conditions.add(new GraphEdge(catalogNode(NodeLabel.HEALTH_CONDITION, link.conditionId(), link.name()), rel));
        }

        List<GraphEdge> allergens = new ArrayList<>();
        for (AllergenLink link : health.allergens()) {
            Map<String, Object> rel = new LinkedHashMap<>();
            rel.put("severity", link.severity());
            rel.put("diagnosis_date", link.diagnosisDate());
            rel.put("is_active", link.active());
            rel.put("reaction_description", link.reactionDescription());
            allergens.add(new GraphEdge(catalogNode(NodeLabel.ALLERGEN, link.allergenId(), link.name()), rel));
        }

        List<GraphEdge> diets = new ArrayList<>();
        for (DietLink link : health.diets()) {
            Map<String, Object> rel = new LinkedHashMap<>();
            rel.put("strictness", link.strictness());
            rel.put("start_date", link.startDate());
            rel.put("is_active", link.active());
            diets.add(new GraphEdge(catalogNode(NodeLabel.DIETARY_PREFERENCE, link.dietId(), link.name()), rel));
        }

        return List.of(
            new RelationshipSet(ownerLabel, ownerId, RelationshipType.HAS_CONDITION,
                NodeLabel.HEALTH_CONDITION, MergeMode.KEEP_EXISTING, conditions),
            new RelationshipSet(ownerLabel, ownerId, RelationshipType.ALLERGIC_TO,
                NodeLabel.ALLERGEN, MergeMode.KEEP_EXISTING, allergens),
            new RelationshipSet(ownerLabel, ownerId, RelationshipType.FOLLOWS_DIET,
                NodeLabel.DIETARY_PREFERENCE, MergeMode.KEEP_EXISTING, diets));
    }

    private static RelationshipSet preferenceSet(String householdId, List<HouseholdPreference> preferences) {
        List<GraphEdge> edges = new ArrayList<>();
        for (HouseholdPreference preference : preferences) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("preference_type", preference.preferenceType());
            props.put("preference_value", preference.preferenceValue());
            props.put("priority", preference.priority());
            props.put("created_at", dateTime(preference.createdAt()));
            edges.add(new GraphEdge(new GraphNode(NodeLabel.HOUSEHOLD_PREFERENCE, preference.id(), props), Map.of()));
        }
        return new RelationshipSet(NodeLabel.HOUSEHOLD, householdId, RelationshipType.HAS_PREFERENCE,
            NodeLabel.HOUSEHOLD_PREFERENCE, MergeMode.OVERWRITE, edges);
    }

    private static RelationshipSet budgetSet(String householdId, List<HouseholdBudget> budgets) {
        List<GraphEdge> edges = new ArrayList<>();
        for (HouseholdBudget budget : budgets) {
            Map<String, Object> props = new LinkedHashMap<>();
            props.put("budget_type", budget.budgetType());
            props.put("amount", decimal(budget.amount()));
            props.put("currency", budget.currency());
            props.put("period", budget.period());
            props.put("start_date", budget.startDate());
            props.put("end_date", budget.endDate());
            props.put("is_active", budget.active());
            props.put("created_at", dateTime(budget.createdAt()));
            edges.add(new GraphEdge(new GraphNode(NodeLabel.HOUSEHOLD_BUDGET, budget.id(), props), Map.of()));
        }
        return new RelationshipSet(NodeLabel.HOUSEHOLD, householdId, RelationshipType.HAS_BUDGET,
            NodeLabel.HOUSEHOLD_BUDGET, MergeMode.OVERWRITE, edges);
    }

    private static GraphNode catalogNode(NodeLabel label, String id, String name) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("name", name);
        return new GraphNode(label, id, props);
    }

    private static GraphNode householdNode(Household household) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("household_name", household.name());
        props.put("household_type", household.type());
        props.put("account_status", household.accountStatus());
        props.put("total_members", household.totalMembers());
        props.put("location_country", household.locationCountry());
        props.put("location_region", household.locationRegion());
        props.put("location_city", household.locationCity());
        props.put("location_postal_code", household.locationPostalCode());
        props.put("created_at", dateTime(household.createdAt()));
        props.put("updated_at", dateTime(household.updatedAt()));
        return new GraphNode(NodeLabel.HOUSEHOLD, household.id(), props);
    }

    private static GraphNode vendorNode(Vendor vendor) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("name", vendor.name());
        props.put("vendor_type", vendor.vendorType());
        props.put("slug", vendor.slug());
        return new GraphNode(NodeLabel.VENDOR, vendor.id(), props);
    }

    private static Map<String, Object> primaryPersonProperties(PrimaryPerson person) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("full_name", person.fullName());
        props.put("first_name", person.firstName());
        props.put("last_name", person.lastName());
        props.put("email", person.email());
        props.put("phone", person.phone());
        props.put("household_role", person.householdRole());
        props.put("birth_year", person.birthYear());
        props.put("birth_month", person.birthMonth());
        props.put("date_of_birth", person.dateOfBirth());
        props.put("age", person.age());
        props.put("gender", person.gender());
        props.put("is_profile_owner", person.profileOwner());
        props.put("account_status", person.accountStatus());
        props.put("created_at", dateTime(person.createdAt()));
        props.put("updated_at", dateTime(person.updatedAt()));
        return props;
    }

    private static Map<String, Object> businessPersonProperties(BusinessPerson person) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("full_name", person.fullName());
        props.put("email", person.email());
        props.put("phone", person.phone());
        props.put("external_id", person.externalId());
        props.put("account_status", person.accountStatus());
        props.put("date_of_birth", person.dateOfBirth());
        props.put("gender", person.gender());
        props.put("created_at", dateTime(person.createdAt()));
        props.put("updated_at", dateTime(person.updatedAt()));
        return props;
    }

    private static Map<String, Object> profileProperties(HealthProfile profile) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("height_cm", profile.heightCm());
        props.put("weight_kg", profile.weightKg());
        props.put("bmi", profile.bmi());
        props.put("bmr", profile.bmr());
        props.put("tdee", profile.tdee());
        props.put("activity_level", profile.activityLevel());
        props.put("health_goal", profile.healthGoal());
        props.put("target_weight_kg", profile.targetWeightKg());
        props.put("target_calories", profile.targetCalories());
        props.put("target_protein_g", profile.targetProteinG());
        props.put("target_carbs_g", profile.targetCarbsG());
        props.put("target_fat_g", profile.targetFatG());
        props.put("target_fiber_g", profile.targetFiberG());
        props.put("target_sodium_mg", profile.targetSodiumMg());
        props.put("target_sugar_g", profile.targetSugarG());
        props.put("created_at", dateTime(profile.createdAt()));
        props.put("updated_at", dateTime(profile.updatedAt()));
        return props;
    }

    private static OffsetDateTime dateTime(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Double decimal(BigDecimal value) {
        return value == null ? null : value.doubleValue();
    }

    private static String describe(List<RelationshipSet> sets) {
        StringBuilder sb = new StringBuilder("{");
        for (RelationshipSet set : sets) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(set.type()).append('=').append(set.edges().size());
        }
        return sb.append('}').toString();
    }
}
