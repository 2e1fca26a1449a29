package io.graphsync.projection;

/**
 * How the properties of an upserted node are merged with the stored ones.
 */
public enum MergeMode {
    /** Every property is written; a {@code null} value removes the stored property. */
    OVERWRITE,
    /** Only non-null properties are written; stored values survive absent ones. */
    KEEP_EXISTING
}
