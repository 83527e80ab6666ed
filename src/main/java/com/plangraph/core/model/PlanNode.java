package com.plangraph.core.model;

/**
 * A node of the plan graph: an epic, a story or a task.
 * <p>
 * The set of variants is closed. Callers branch on {@link #kind()} and read the
 * shared fields through {@link #fields()}.
 */
public sealed interface PlanNode permits EpicNode, StoryNode, TaskNode {

    NodeKind kind();

    NodeFields fields();

    default String id() {
        return fields().id();
    }

    default String description() {
        return fields().description();
    }

    default Status status() {
        return fields().status();
    }

    default int priority() {
        return fields().priority();
    }
}
