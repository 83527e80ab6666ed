package com.plangraph.dispatch.cli;

import com.plangraph.core.api.DotRequest;
import com.plangraph.core.api.RenderedPlan;
import com.plangraph.core.config.PlangraphProperties;
import com.plangraph.core.engine.PlanEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: plangraph dot &lt;plan.xml&gt;
 */
@Command(name = "dot", mixinStandardHelpOptions = true, description = "Print the plan graph in Graphviz DOT")
@Component
public class DotCommand extends RenderCommand {

    @Option(names = "--descriptions", negatable = true,
            description = "Attach descriptions as edge end labels (default from plangraph.defaults.include-descriptions)")
    private Boolean descriptions;

    public DotCommand(PlanEngine planEngine, PlangraphProperties properties) {
        super(planEngine, properties);
    }

    @Override
    protected RenderedPlan render() {
        boolean include = descriptions != null ? descriptions : properties.isIncludeDescriptions();
        return planEngine.toDot(new DotRequest(include));
    }
}
