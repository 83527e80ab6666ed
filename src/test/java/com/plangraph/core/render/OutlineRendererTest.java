package com.plangraph.core.render;

import com.plangraph.core.api.OutlineRequest;
import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.graph.EdgeKind;
import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.model.EpicNode;
import com.plangraph.core.model.NodeFields;
import com.plangraph.core.model.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.plangraph.core.render.RenderFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

class OutlineRendererTest {

    private final OutlineRenderer renderer = new OutlineRenderer();

    @Test
    void reportsFormat() {
        assertEquals(RenderFormat.OUTLINE, renderer.format());
    }

    @Test
    @DisplayName("hierarchy with status, two spaces per level")
    void scenarioWithStatus() {
        String out = renderer.render(RenderFixtures.scenario(), new OutlineRequest(true));
        assertEquals(String.join("\n",
                "- E1: Ship v1 (in_progress)",
                "  - S1: Core (complete)",
                "    - T1: Model (complete)",
                "    - T2: Graph (pending)"), out);
    }

    @Test
    @DisplayName("status suffix omitted on request")
    void scenarioWithoutStatus() {
        String out = renderer.render(RenderFixtures.scenario(), new OutlineRequest(false));
        assertEquals(String.join("\n",
                "- E1: Ship v1",
                "  - S1: Core",
                "    - T1: Model",
                "    - T2: Graph"), out);
    }

    @Test
    @DisplayName("dangling dependency targets are not printed")
    void danglingNotPrinted() {
        String out = renderer.render(RenderFixtures.dangling(), OutlineRequest.DEFAULT);
        assertFalse(out.contains("EXT-9"));
        assertEquals(3, out.split("\n").length);
    }

    @Test
    @DisplayName("empty graph renders as empty text")
    void emptyGraph() {
        assertEquals("", renderer.render(PlanGraph.empty(), OutlineRequest.DEFAULT));
    }

    @Test
    @DisplayName("cyclic containment terminates and prints each node once")
    void cyclicContainment() {
        PlanGraph graph = PlanGraph.builder()
                .addNode(new EpicNode(new NodeFields("R", "root", Status.PENDING, 1), List.of()))
                .addNode(task("C", "c", Status.PENDING))
                .addNode(task("D", "d", Status.PENDING))
                .addEdge("C", "R", EdgeKind.COMPONENT_OF)
                .addEdge("C", "D", EdgeKind.COMPONENT_OF)
                .addEdge("D", "C", EdgeKind.COMPONENT_OF)
                .build();

        String out = assertTimeoutPreemptively(java.time.Duration.ofSeconds(5),
                () -> renderer.render(graph, new OutlineRequest(false)));
        assertEquals(String.join("\n",
                "- R: root",
                "  - C: c",
                "    - D: d"), out);
    }

    @Test
    @DisplayName("rendering does not change the graph and is repeatable")
    void pure() {
        PlanGraph graph = RenderFixtures.scenario();
        int nodes = graph.nodeCount();
        int edges = graph.edgeCount();
        String first = renderer.render(graph, OutlineRequest.DEFAULT);
        String second = renderer.render(graph, OutlineRequest.DEFAULT);
        assertEquals(first, second);
        assertEquals(nodes, graph.nodeCount());
        assertEquals(edges, graph.edgeCount());
    }
}
