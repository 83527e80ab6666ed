package com.plangraph.dispatch.cli;

import com.plangraph.core.engine.PlanEngine;
import com.plangraph.core.engine.PlanSnapshot;
import com.plangraph.core.schema.PlanBuildException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: plangraph validate &lt;plan.xml&gt;
 * <p>
 * Builds the plan graph and reports node, edge and dropped-element counts.
 * Exits with 1 when the document cannot be built.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a plan and summarise its graph")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan XML file")
    private Path planFile;

    private final PlanEngine planEngine;

    public ValidateCommand(PlanEngine planEngine) {
        this.planEngine = planEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        PlanSnapshot snapshot;
        try {
            snapshot = planEngine.buildFrom(planFile);
        } catch (PlanBuildException e) {
            ConsoleOutput.buildFailure(e);
            return 1;
        }

        ConsoleOutput.success("Plan v" + snapshot.plan().version() + " is valid");
        ConsoleOutput.info(snapshot.plan().epics().size() + " epic(s), "
                + snapshot.graph().nodeCount() + " node(s), "
                + snapshot.graph().edgeCount() + " edge(s)");

        var report = snapshot.report();
        if (report.hasDrops()) {
            ConsoleOutput.warn(report.dropped().size() + " of " + report.elementsSeen()
                    + " element(s) dropped:");
            report.dropped().forEach(ConsoleOutput::dropped);
        }
        return 0;
    }
}
