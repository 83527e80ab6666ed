package com.plangraph.core.engine;

import com.plangraph.core.api.DotRequest;
import com.plangraph.core.api.FlowchartRequest;
import com.plangraph.core.api.InvalidPlanRequestException;
import com.plangraph.core.api.OutlineRequest;
import com.plangraph.core.api.PlanRequestReader;
import com.plangraph.core.api.ReadyTasksRequest;
import com.plangraph.core.api.ReadyTasksResponse;
import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.api.RenderedPlan;
import com.plangraph.core.graph.GraphBuilder;
import com.plangraph.core.graph.PlanGraph;
import com.plangraph.core.logging.MdcContext;
import com.plangraph.core.metrics.PlangraphMetrics;
import com.plangraph.core.model.Plan;
import com.plangraph.core.parser.ParseReport;
import com.plangraph.core.parser.ParsedPlan;
import com.plangraph.core.parser.PlanParser;
import com.plangraph.core.query.ReadyTaskQuery;
import com.plangraph.core.render.DotRenderer;
import com.plangraph.core.render.FlowchartRenderer;
import com.plangraph.core.render.OutlineRenderer;
import com.plangraph.core.render.PlanRenderer;
import com.plangraph.core.schema.PlanBuildException;
import com.plangraph.core.schema.PlanSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Owns the current plan and graph and answers queries against them.
 * <p>
 * A build runs validate, parse and graph construction, then swaps the new
 * snapshot in as a whole. If any step fails the previous snapshot stays
 * current. Builds are serialized; queries read whatever snapshot is current
 * and never change it.
 */
@Service
public class PlanEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanEngine.class);

    private final PlanSchemaValidator validator;
    private final PlanParser parser;
    private final GraphBuilder graphBuilder;
    private final ReadyTaskQuery readyTaskQuery;
    private final OutlineRenderer outlineRenderer;
    private final FlowchartRenderer flowchartRenderer;
    private final DotRenderer dotRenderer;
    private final PlanRequestReader requestReader;
    private final PlangraphMetrics metrics;

    private volatile PlanSnapshot snapshot = PlanSnapshot.empty();

    public PlanEngine(PlanSchemaValidator validator, PlanParser parser, GraphBuilder graphBuilder,
                      ReadyTaskQuery readyTaskQuery, OutlineRenderer outlineRenderer,
                      FlowchartRenderer flowchartRenderer, DotRenderer dotRenderer,
                      PlanRequestReader requestReader, PlangraphMetrics metrics) {
        this.validator = validator;
        this.parser = parser;
        this.graphBuilder = graphBuilder;
        this.readyTaskQuery = readyTaskQuery;
        this.outlineRenderer = outlineRenderer;
        this.flowchartRenderer = flowchartRenderer;
        this.dotRenderer = dotRenderer;
        this.requestReader = requestReader;
        this.metrics = metrics;
    }

    /**
     * Validates, parses and builds the graph for a plan file, replacing the
     * current plan and graph.
     *
     * @param path plan document
     * @return the new snapshot
     * @throws PlanBuildException if the document is unreadable, malformed or
     *                            violates the schema; nothing is replaced then
     */
    public synchronized PlanSnapshot buildFrom(Path path) throws PlanBuildException {
        long start = System.currentTimeMillis();
        MdcContext.setPlanSource(path.toString());
        try {
            log.info("Building plan graph from {}", path);
            Document document = validator.validate(path);
            ParsedPlan parsed = parser.parse(document);
            MdcContext.setPlanVersion(parsed.plan().version());
            PlanGraph graph = graphBuilder.build(parsed.plan());

            PlanSnapshot next = new PlanSnapshot(path.toString(), parsed.plan(), graph, parsed.report());
            snapshot = next;

            long elapsed = System.currentTimeMillis() - start;
            parsed.report().dropped().forEach(metrics::recordDropped);
            metrics.recordBuild("success", elapsed);
            log.info("Plan v{} built: {} nodes, {} edges, {} element(s) dropped ({}ms)",
                    parsed.plan().version(), graph.nodeCount(), graph.edgeCount(),
                    parsed.report().dropped().size(), elapsed);
            return next;
        } catch (PlanBuildException e) {
            metrics.recordBuild(e.getKind().name().toLowerCase(), System.currentTimeMillis() - start);
            log.error("Plan build failed ({}): {}", e.getKind(), e.getMessage());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public PlanSnapshot snapshot() {
        return snapshot;
    }

    public Plan plan() {
        return snapshot.plan();
    }

    public PlanGraph graph() {
        return snapshot.graph();
    }

    public ParseReport parseReport() {
        return snapshot.report();
    }

    public ReadyTasksResponse readyTasks(ReadyTasksRequest request) {
        requireOptions(request, ReadyTasksRequest.class);
        List<String> ready = readyTaskQuery.readyTasks(snapshot.graph(), request.includeInProgress());
        metrics.recordReadyTasks(ready.size());
        return new ReadyTasksResponse(ready);
    }

    /**
     * Ready tasks for loosely typed options, e.g. {@code {"include_in_progress": true}}.
     *
     * @throws InvalidPlanRequestException if the options are malformed; the graph is not read then
     */
    public ReadyTasksResponse readyTasks(Map<String, ?> options) {
        return readyTasks(requestReader.read(options, ReadyTasksRequest.class));
    }

    /**
     * Unsatisfied direct dependencies of one task.
     */
    public List<String> blockers(String taskId) {
        return readyTaskQuery.blockers(snapshot.graph(), taskId);
    }

    public RenderedPlan toOutline(OutlineRequest request) {
        return render(outlineRenderer, request, OutlineRequest.class);
    }

    public RenderedPlan toFlowchart(FlowchartRequest request) {
        return render(flowchartRenderer, request, FlowchartRequest.class);
    }

    public RenderedPlan toDot(DotRequest request) {
        return render(dotRenderer, request, DotRequest.class);
    }

    /**
     * Renders the graph in the given format from loosely typed options.
     *
     * @throws InvalidPlanRequestException if the options are malformed; the graph is not read then
     */
    public RenderedPlan render(RenderFormat format, Map<String, ?> options) {
        return switch (format) {
            case OUTLINE -> toOutline(requestReader.read(options, OutlineRequest.class));
            case FLOWCHART -> toFlowchart(requestReader.read(options, FlowchartRequest.class));
            case DOT -> toDot(requestReader.read(options, DotRequest.class));
        };
    }

    private <O> RenderedPlan render(PlanRenderer<O> renderer, O request, Class<O> type) {
        requireOptions(request, type);
        return new RenderedPlan(renderer.format(), renderer.render(snapshot.graph(), request));
    }

    private static void requireOptions(Object request, Class<?> type) {
        if (request == null) {
            throw new InvalidPlanRequestException("Options for " + type.getSimpleName() + " must not be null");
        }
    }
}
