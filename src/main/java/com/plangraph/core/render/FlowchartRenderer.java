package com.plangraph.core.render;

import com.plangraph.core.api.FlowchartRequest;
import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.graph.EdgeKind;
import com.plangraph.core.graph.PlanEdge;
import com.plangraph.core.graph.PlanGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Mermaid {@code graph TD} flowchart with one line per edge. Dependencies are
 * dotted arrows, containment is a solid arrow. Descriptions are written as
 * quoted labels, {@code id["text"]}.
 */
@Component
public class FlowchartRenderer implements PlanRenderer<FlowchartRequest> {

    static final String SOLID_ARROW = "-->";
    static final String DOTTED_ARROW = "-.->";

    @Override
    public RenderFormat format() {
        return RenderFormat.FLOWCHART;
    }

    @Override
    public String render(PlanGraph graph, FlowchartRequest options) {
        var lines = new ArrayList<String>();
        lines.add("graph TD");
        for (PlanEdge edge : graph.edges()) {
            String arrow = edge.kind() == EdgeKind.DEPENDS_ON ? DOTTED_ARROW : SOLID_ARROW;
            lines.add("    " + endpoint(graph, edge.source(), options.includeDescriptions())
                    + " " + arrow + " "
                    + endpoint(graph, edge.target(), options.includeDescriptions()));
        }
        return String.join("\n", lines);
    }

    // Dangling dependency targets and blank descriptions leave the id bare.
    private static String endpoint(PlanGraph graph, String id, boolean includeDescription) {
        if (!includeDescription) return id;
        return graph.node(id)
                .filter(node -> !node.description().isBlank())
                .map(node -> id + "[\"" + label(node.description()) + "\"]")
                .orElse(id);
    }

    /**
     * Mermaid entity escaping for a quoted label. {@code #} goes first since
     * the other escapes introduce it.
     */
    static String label(String description) {
        return description
                .replace("#", "#35;")
                .replace("\"", "#quot;")
                .replace("\r", "")
                .replace("\n", "<br/>");
    }
}
