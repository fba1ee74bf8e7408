package org.energysaving.datapipeline.nodes;

/**
 * Variant tag of a {@link Node}.
 */
public enum NodeKind {
    /** One raw series. */
    SIMPLE,
    /** Aggregate of child nodes. */
    COMPOSITE,
    /** Series derived from a base node by a named transformer. */
    DERIVED
}
