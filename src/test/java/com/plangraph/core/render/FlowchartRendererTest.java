package com.plangraph.core.render;

import com.plangraph.core.api.FlowchartRequest;
import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.graph.GraphBuilder;
import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.model.EpicNode;
import com.plangraph.core.model.NodeFields;
import com.plangraph.core.model.Plan;
import com.plangraph.core.model.Status;
import com.plangraph.core.model.StoryNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowchartRendererTest {

    private final FlowchartRenderer renderer = new FlowchartRenderer();

    @Test
    void reportsFormat() {
        assertEquals(RenderFormat.FLOWCHART, renderer.format());
    }

    @Test
    @DisplayName("one line per edge with node descriptions")
    void withDescriptions() {
        String out = renderer.render(RenderFixtures.scenario(), new FlowchartRequest(true));
        assertEquals(String.join("\n",
                "graph TD",
                "    S1[\"Core\"] --> E1[\"Ship v1\"]",
                "    T1[\"Model\"] --> S1[\"Core\"]",
                "    T2[\"Graph\"] --> S1[\"Core\"]",
                "    T2[\"Graph\"] -.-> T1[\"Model\"]"), out);
    }

    @Test
    @DisplayName("bare ids without descriptions")
    void withoutDescriptions() {
        String out = renderer.render(RenderFixtures.scenario(), new FlowchartRequest(false));
        assertEquals(String.join("\n",
                "graph TD",
                "    S1 --> E1",
                "    T1 --> S1",
                "    T2 --> S1",
                "    T2 -.-> T1"), out);
    }

    @Test
    @DisplayName("dangling dependency target is drawn as a bare id")
    void danglingTarget() {
        String out = renderer.render(RenderFixtures.dangling(), FlowchartRequest.DEFAULT);
        assertTrue(out.contains("    T[\"Task\"] -.-> EXT-9"), out);
    }

    @Test
    @DisplayName("brackets and parentheses stay inside the quoted label")
    void bracketsInDescription() {
        String out = renderer.render(graphWith("Fix [bug] (v2)", ""), FlowchartRequest.DEFAULT);
        assertTrue(out.contains("    T[\"Fix [bug] (v2)\"] --> S"), out);
    }

    @Test
    @DisplayName("blank description leaves the id bare")
    void blankDescription() {
        String out = renderer.render(graphWith("t", ""), FlowchartRequest.DEFAULT);
        assertTrue(out.contains("    S --> E[\"e\"]"), out);
        assertFalse(out.contains("S[]"), out);
        assertFalse(out.contains("S[\"\"]"), out);
    }

    @Test
    @DisplayName("quotes, hashes and newlines are written as Mermaid entities")
    void escaping() {
        assertEquals("say #quot;hi#quot; #35;1<br/>next", FlowchartRenderer.label("say \"hi\" #1\r\nnext"));
    }

    private static PlanGraph graphWith(String taskDescription, String storyDescription) {
        var story = new StoryNode(new NodeFields("S", storyDescription, Status.PENDING, 1), 0,
                List.of(RenderFixtures.task("T", taskDescription, Status.PENDING)));
        var epic = new EpicNode(new NodeFields("E", "e", Status.PENDING, 1), List.of(story));
        return new GraphBuilder().build(new Plan("1.0", List.of(epic)));
    }

    @Test
    @DisplayName("empty graph renders the header only")
    void emptyGraph() {
        assertEquals("graph TD", renderer.render(PlanGraph.empty(), FlowchartRequest.DEFAULT));
    }
}
