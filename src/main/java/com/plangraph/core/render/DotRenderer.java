package com.plangraph.core.render;

import com.plangraph.core.api.DotRequest;
import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.graph.EdgeKind;
import com.plangraph.core.graph.PlanEdge;
import com.plangraph.core.graph.PlanGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Graphviz DOT description with one line per edge.
 * <p>
 * Dependency edges are dashed. With descriptions on, the source and target
 * descriptions travel as {@code taillabel} and {@code headlabel} of the edge.
 */
@Component
public class DotRenderer implements PlanRenderer<DotRequest> {

    @Override
    public RenderFormat format() {
        return RenderFormat.DOT;
    }

    @Override
    public String render(PlanGraph graph, DotRequest options) {
        var lines = new ArrayList<String>();
        lines.add("digraph {");
        for (PlanEdge edge : graph.edges()) {
            var attributes = new ArrayList<String>();
            if (edge.kind() == EdgeKind.DEPENDS_ON) {
                attributes.add("style=dashed");
            }
            if (options.includeDescriptions()) {
                graph.node(edge.source()).ifPresent(n -> attributes.add("taillabel=" + quote(n.description())));
                graph.node(edge.target()).ifPresent(n -> attributes.add("headlabel=" + quote(n.description())));
            }

            var line = new StringBuilder("    ")
                    .append(quote(edge.source())).append(" -> ").append(quote(edge.target()));
            if (!attributes.isEmpty()) {
                line.append(" [").append(String.join(", ", attributes)).append(']');
            }
            lines.add(line.toString());
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\r", "").replace("\n", "\\n") + "\"";
    }
}
