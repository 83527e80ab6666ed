package com.plangraph.core.model;

import java.util.List;

/**
 * A story: an estimated group of tasks inside an epic.
 *
 * @param fields shared fields
 * @param points story points estimate
 * @param tasks  tasks in document order
 */
public record StoryNode(
    NodeFields fields,
    int points,
    List<TaskNode> tasks
) implements PlanNode {

    public StoryNode {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STORY;
    }
}
