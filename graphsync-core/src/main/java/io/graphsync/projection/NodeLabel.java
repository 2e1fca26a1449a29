package io.graphsync.projection;

/**
 * Node labels of the graph projection. Every node is keyed by an {@code id} property
 * unique within its label.
 */
public enum NodeLabel {
    B2C_CUSTOMER("B2CCustomer"),
    B2B_CUSTOMER("B2BCustomer"),
    HOUSEHOLD("Household"),
    VENDOR("Vendor"),
    B2C_HEALTH_PROFILE("B2CHealthProfile"),
    B2B_HEALTH_PROFILE("B2BHealthProfile"),
    HEALTH_CONDITION("HealthCondition"),
    ALLERGEN("Allergen"),
    DIETARY_PREFERENCE("DietaryPreference"),
    HOUSEHOLD_PREFERENCE("HouseholdPreference"),
    HOUSEHOLD_BUDGET("HouseholdBudget");

    private final String graphName;

    NodeLabel(String graphName) {
        this.graphName = graphName;
    }

    /**
     * Label as it appears in the graph store.
     */
    public String graphName() {
        return graphName;
    }
}
