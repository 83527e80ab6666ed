package com.plangraph.core.model;

import java.util.List;

/**
 * Top level of the work breakdown.
 *
 * @param fields  shared fields
 * @param stories stories in document order
 */
public record EpicNode(
    NodeFields fields,
    List<StoryNode> stories
) implements PlanNode {

    public EpicNode {
        stories = stories != null ? List.copyOf(stories) : List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EPIC;
    }
}
