package com.plangraph.dispatch.cli;

import com.plangraph.core.api.RenderedPlan;
import com.plangraph.core.config.PlangraphProperties;
import com.plangraph.core.engine.PlanEngine;
import com.plangraph.core.schema.PlanBuildException;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shared plumbing of the commands that print a rendering of the plan graph.
 * The rendering goes to stdout, or to {@code --output} as UTF-8.
 */
abstract class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan XML file")
    private Path planFile;

    @Option(names = {"--output", "-o"}, description = "Write the rendering to this file instead of stdout")
    private Path output;

    protected final PlanEngine planEngine;
    protected final PlangraphProperties properties;

    protected RenderCommand(PlanEngine planEngine, PlangraphProperties properties) {
        this.planEngine = planEngine;
        this.properties = properties;
    }

    protected abstract RenderedPlan render();

    @Override
    public Integer call() {
        try {
            planEngine.buildFrom(planFile);
        } catch (PlanBuildException e) {
            ConsoleOutput.buildFailure(e);
            return 1;
        }

        RenderedPlan rendered = render();
        if (output == null) {
            System.out.println(rendered.content());
            return 0;
        }
        try {
            Files.writeString(output, rendered.content() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success(rendered.format().name().toLowerCase() + " written to " + output);
        return 0;
    }
}
