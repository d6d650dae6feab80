package de.t14d3.kvstore.mapping;

/**
 * How a mapped field takes part in persistence.
 */
public enum FieldKind {
    /** Stored as-is in the owning record. */
    PLAIN,
    /** Stored as a nested map built from an embeddable instance. */
    EMBEDDED,
    /** Never stored. */
    TRANSIENT
}
