package com.plangraph.core.render;

import com.plangraph.core.api.OutlineRequest;
import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.graph.EdgeKind;
import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.model.PlanNode;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Nested bullet list of the plan hierarchy.
 * <p>
 * Roots are the nodes without an outgoing component-of edge. From each root
 * the walk follows incoming component-of edges, depth first, two spaces of
 * indent per level. Every node is printed at most once, which also stops the
 * walk on a cyclic hierarchy.
 */
@Component
public class OutlineRenderer implements PlanRenderer<OutlineRequest> {

    private record Frame(String id, int depth) {}

    @Override
    public RenderFormat format() {
        return RenderFormat.OUTLINE;
    }

    @Override
    public String render(PlanGraph graph, OutlineRequest options) {
        var lines = new ArrayList<String>();
        Set<String> visited = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (PlanNode root : graph.nodes()) {
            if (!graph.successors(root.id(), EdgeKind.COMPONENT_OF).isEmpty()) continue;

            stack.push(new Frame(root.id(), 0));
            while (!stack.isEmpty()) {
                Frame frame = stack.pop();
                if (!visited.add(frame.id())) continue;

                var node = graph.node(frame.id());
                if (node.isEmpty()) continue;
                lines.add(line(node.get(), frame.depth(), options.includeStatus()));

                // reversed so the first child is popped first
                List<String> children = graph.predecessors(frame.id(), EdgeKind.COMPONENT_OF);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(children.get(i), frame.depth() + 1));
                }
            }
        }
        return String.join("\n", lines);
    }

    private static String line(PlanNode node, int depth, boolean includeStatus) {
        var sb = new StringBuilder();
        sb.append("  ".repeat(depth)).append("- ").append(node.id()).append(": ").append(node.description());
        if (includeStatus) {
            sb.append(" (").append(node.status().value()).append(')');
        }
        return sb.toString();
    }
}
