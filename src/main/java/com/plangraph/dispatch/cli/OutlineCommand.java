package com.plangraph.dispatch.cli;

import com.plangraph.core.api.OutlineRequest;
import com.plangraph.core.api.RenderedPlan;
import com.plangraph.core.config.PlangraphProperties;
import com.plangraph.core.engine.PlanEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: plangraph outline &lt;plan.xml&gt;
 */
@Command(name = "outline", mixinStandardHelpOptions = true, description = "Print the plan hierarchy as a nested list")
@Component
public class OutlineCommand extends RenderCommand {

    @Option(names = "--status", negatable = true,
            description = "Append each node's status (default from plangraph.defaults.include-status)")
    private Boolean status;

    public OutlineCommand(PlanEngine planEngine, PlangraphProperties properties) {
        super(planEngine, properties);
    }

    @Override
    protected RenderedPlan render() {
        boolean includeStatus = status != null ? status : properties.isIncludeStatus();
        return planEngine.toOutline(new OutlineRequest(includeStatus));
    }
}
