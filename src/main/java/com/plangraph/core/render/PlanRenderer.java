package com.plangraph.core.render;

import com.plangraph.core.api.RenderFormat;
import com.plangraph.core.graph.PlanGraph;

/**
 * Pure text rendering of a built plan graph. Implementations never modify the
 * graph, and the same graph and options always yield the same text.
 *
 * @param <O> option record of the renderer
 */
public interface PlanRenderer<O> {

    RenderFormat format();

    String render(PlanGraph graph, O options);
}
