package io.graphsync.projection;

/**
 * Relationship types of the graph projection. The enum constant name is the type name
 * used in the graph store.
 */
public enum RelationshipType {
    BELONGS_TO_HOUSEHOLD(false),
    BELONGS_TO_VENDOR(false),
    HAS_PROFILE(true),
    HAS_CONDITION(false),
    ALLERGIC_TO(false),
    FOLLOWS_DIET(false),
    HAS_PREFERENCE(true),
    HAS_BUDGET(true);

    private final boolean ownsTarget;

    RelationshipType(boolean ownsTarget) {
        this.ownsTarget = ownsTarget;
    }

    /**
     * Whether the target node exists only for its owner. Owned targets are deleted when
     * the owner drops them or is itself deleted; shared catalog targets never are.
     */
    public boolean ownsTarget() {
        return ownsTarget;
    }
}
