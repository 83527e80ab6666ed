package com.plangraph.core.query;

import com.plangraph.core.graph.EdgeKind;
import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.model.NodeKind;
import com.plangraph.core.model.PlanNode;
import com.plangraph.core.model.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes which tasks can start now.
 * <p>
 * A task is ready when it is not complete (in-progress tasks only on request)
 * and every direct dependency is a node whose status is complete. Dependencies
 * of dependencies are not looked at. A dependency on an id that is not in the
 * graph is never satisfied.
 */
@Component
public class ReadyTaskQuery {

    private static final Logger log = LoggerFactory.getLogger(ReadyTaskQuery.class);

    /**
     * @param graph             built plan graph, read only
     * @param includeInProgress whether in-progress tasks may be reported
     * @return ready task ids in graph node order
     */
    public List<String> readyTasks(PlanGraph graph, boolean includeInProgress) {
        var ready = new ArrayList<String>();
        for (PlanNode node : graph.nodes()) {
            if (node.kind() != NodeKind.TASK) continue;

            if (node.status() == Status.COMPLETE) {
                log.debug("  {}: already complete", node.id());
                continue;
            }
            if (node.status() == Status.IN_PROGRESS && !includeInProgress) {
                log.debug("  {}: in progress, not requested", node.id());
                continue;
            }
            List<String> blockers = blockers(graph, node.id());
            if (!blockers.isEmpty()) {
                log.debug("  {}: waiting on {}", node.id(), blockers);
                continue;
            }
            log.debug("  {}: ready", node.id());
            ready.add(node.id());
        }
        return ready;
    }

    /**
     * Direct dependencies of {@code taskId} that are not satisfied: ids with no
     * node, and nodes that are not complete. Empty for unknown ids.
     */
    public List<String> blockers(PlanGraph graph, String taskId) {
        var blockers = new ArrayList<String>();
        for (String dep : graph.successors(taskId, EdgeKind.DEPENDS_ON)) {
            Optional<PlanNode> target = graph.node(dep);
            if (target.isEmpty() || target.get().status() != Status.COMPLETE) {
                blockers.add(dep);
            }
        }
        return blockers;
    }
}
