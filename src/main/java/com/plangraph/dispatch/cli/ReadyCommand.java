package com.plangraph.dispatch.cli;

import com.plangraph.core.api.ReadyTasksRequest;
import com.plangraph.core.config.PlangraphProperties;
import com.plangraph.core.engine.PlanEngine;
import com.plangraph.core.model.NodeKind;
import com.plangraph.core.model.PlanNode;
import com.plangraph.core.model.Status;
import com.plangraph.core.schema.PlanBuildException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: plangraph ready &lt;plan.xml&gt;
 * <p>
 * Lists the tasks whose direct dependencies are all complete. With
 * {@code --explain}, also lists the open tasks that are still blocked and what
 * they wait on.
 */
@Command(name = "ready", mixinStandardHelpOptions = true, description = "List tasks that can start now")
@Component
public class ReadyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan XML file")
    private Path planFile;

    @Option(names = "--include-in-progress", negatable = true,
            description = "Also list tasks already in progress (default from plangraph.defaults.include-in-progress)")
    private Boolean includeInProgress;

    @Option(names = "--explain", description = "Show blocked tasks and their unmet dependencies")
    private boolean explain;

    @Option(names = "--sorted", description = "Sort task ids instead of using plan order")
    private boolean sorted;

    private final PlanEngine planEngine;
    private final PlangraphProperties properties;

    public ReadyCommand(PlanEngine planEngine, PlangraphProperties properties) {
        this.planEngine = planEngine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        try {
            planEngine.buildFrom(planFile);
        } catch (PlanBuildException e) {
            ConsoleOutput.buildFailure(e);
            return 1;
        }

        boolean inProgress = includeInProgress != null ? includeInProgress : properties.isIncludeInProgress();
        List<String> ready = new ArrayList<>(planEngine.readyTasks(new ReadyTasksRequest(inProgress)).tasks());
        if (sorted) {
            ready.sort(null);
        }

        if (ready.isEmpty()) {
            ConsoleOutput.info("No tasks are ready");
        } else {
            ConsoleOutput.info(ready.size() + " task(s) ready:");
            var graph = planEngine.graph();
            for (String id : ready) {
                ConsoleOutput.readyTask(id, graph.node(id).map(PlanNode::description).orElse(""));
            }
        }

        if (explain) {
            for (PlanNode node : planEngine.graph().nodes()) {
                if (node.kind() != NodeKind.TASK || node.status() == Status.COMPLETE) continue;
                List<String> blockers = planEngine.blockers(node.id());
                if (!blockers.isEmpty()) {
                    ConsoleOutput.blockedTask(node.id(), blockers);
                }
            }
        }
        return 0;
    }
}
