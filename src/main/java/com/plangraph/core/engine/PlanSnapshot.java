package com.plangraph.core.engine;

import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.model.Plan;
import com.plangraph.core.parser.ParseReport;

/**
 * Result of one successful build. Plan, graph and report always come from the
 * same document.
 *
 * @param source where the plan was read from, empty before the first build
 */
public record PlanSnapshot(
    String source,
    Plan plan,
    PlanGraph graph,
    ParseReport report
) {
    public static PlanSnapshot empty() {
        return new PlanSnapshot("", Plan.empty(), PlanGraph.empty(), ParseReport.empty());
    }
}
