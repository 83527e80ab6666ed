package com.plangraph.core.render;

import com.plangraph.core.graph.GraphBuilder;
import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.model.EpicNode;
import com.plangraph.core.model.NodeFields;
import com.plangraph.core.model.Plan;
import com.plangraph.core.model.Status;
import com.plangraph.core.model.StoryNode;
import com.plangraph.core.model.TaskNode;

import java.util.List;

final class RenderFixtures {

    private RenderFixtures() {}

    static TaskNode task(String id, String description, Status status, String... deps) {
        return new TaskNode(new NodeFields(id, description, status, 1), List.of(deps));
    }

    /** E1 in progress "Ship v1" / S1 complete "Core" / T1 complete "Model", T2 pending "Graph" on T1. */
    static PlanGraph scenario() {
        var s1 = new StoryNode(new NodeFields("S1", "Core", Status.COMPLETE, 1), 2, List.of(
                task("T1", "Model", Status.COMPLETE),
                task("T2", "Graph", Status.PENDING, "T1")));
        var e1 = new EpicNode(new NodeFields("E1", "Ship v1", Status.IN_PROGRESS, 1), List.of(s1));
        return new GraphBuilder().build(new Plan("1.0", List.of(e1)));
    }

    /** Single story whose task depends on an id outside the plan. */
    static PlanGraph dangling() {
        var s = new StoryNode(new NodeFields("S", "Story", Status.PENDING, 1), 0, List.of(
                task("T", "Task", Status.PENDING, "EXT-9")));
        var e = new EpicNode(new NodeFields("E", "Epic", Status.PENDING, 1), List.of(s));
        return new GraphBuilder().build(new Plan("1.0", List.of(e)));
    }
}
