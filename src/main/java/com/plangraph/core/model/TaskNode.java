package com.plangraph.core.model;

import java.util.List;

/**
 * A unit of work inside a story.
 *
 * @param fields    shared fields
 * @param dependsOn ids of tasks that must be complete first, in document order;
 *                  entries may name ids that are not in the plan
 */
public record TaskNode(
    NodeFields fields,
    List<String> dependsOn
) implements PlanNode {

    public TaskNode {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TASK;
    }
}
