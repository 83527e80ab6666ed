package com.plangraph.dispatch.cli;

import com.plangraph.core.api.FlowchartRequest;
import com.plangraph.core.api.RenderedPlan;
import com.plangraph.core.config.PlangraphProperties;
import com.plangraph.core.engine.PlanEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: plangraph flowchart &lt;plan.xml&gt;
 */
@Command(name = "flowchart", mixinStandardHelpOptions = true, description = "Print the plan graph as a Mermaid flowchart")
@Component
public class FlowchartCommand extends RenderCommand {

    @Option(names = "--descriptions", negatable = true,
            description = "Label nodes with their description (default from plangraph.defaults.include-descriptions)")
    private Boolean descriptions;

    public FlowchartCommand(PlanEngine planEngine, PlangraphProperties properties) {
        super(planEngine, properties);
    }

    @Override
    protected RenderedPlan render() {
        boolean include = descriptions != null ? descriptions : properties.isIncludeDescriptions();
        return planEngine.toFlowchart(new FlowchartRequest(include));
    }
}
