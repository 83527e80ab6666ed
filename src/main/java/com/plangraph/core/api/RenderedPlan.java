package com.plangraph.core.api;

/**
 * Text rendering of a plan graph.
 *
 * @param format  which renderer produced it
 * @param content lines joined with {@code \n}, no trailing newline
 */
public record RenderedPlan(RenderFormat format, String content) {}
