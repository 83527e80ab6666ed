package com.plangraph.core.model;

/**
 * Discriminator of the {@link PlanNode} union.
 */
public enum NodeKind {
    EPIC,
    STORY,
    TASK
}
