package io.graphsync.aggregate;

/**
 * Selects which family of person tables (B2C or B2B) a health read targets.
 */
public enum PersonKind {
    PRIMARY,
    BUSINESS
}
