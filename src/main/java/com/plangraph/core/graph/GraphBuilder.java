package com.plangraph.core.graph;

import com.plangraph.core.model.EpicNode;
import com.plangraph.core.model.Plan;
import com.plangraph.core.model.StoryNode;
import com.plangraph.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens a {@link Plan} into a {@link PlanGraph}.
 * <p>
 * Each call produces a brand new graph; nothing carries over from a previous
 * build. Dependency targets are recorded as given, whether or not the plan
 * contains them.
 */
@Component
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public PlanGraph build(Plan plan) {
        var builder = PlanGraph.builder();
        for (EpicNode epic : plan.epics()) {
            builder.addNode(epic);
            for (StoryNode story : epic.stories()) {
                builder.addNode(story);
                builder.addEdge(story.id(), epic.id(), EdgeKind.COMPONENT_OF);
                for (TaskNode task : story.tasks()) {
                    builder.addNode(task);
                    builder.addEdge(task.id(), story.id(), EdgeKind.COMPONENT_OF);
                    for (String dep : task.dependsOn()) {
                        builder.addEdge(task.id(), dep, EdgeKind.DEPENDS_ON);
                    }
                }
            }
        }
        PlanGraph graph = builder.build();

        for (var edge : graph.edges()) {
            if (edge.kind() == EdgeKind.DEPENDS_ON && !graph.containsNode(edge.target())) {
                log.warn("Task {} depends on unknown id {}", edge.source(), edge.target());
            }
        }
        log.debug("Built graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}
