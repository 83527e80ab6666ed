package com.plangraph.core.graph;

/**
 * Relation carried by a plan graph edge.
 */
public enum EdgeKind {
    /** Structural child to parent: task to story, story to epic. */
    COMPONENT_OF,
    /** Task to a task that must be complete first. */
    DEPENDS_ON
}
