package com.plangraph.core.graph;

/**
 * Directed, typed edge. Identity is the (source, target, kind) triple.
 *
 * @param source id of the node the edge leaves
 * @param target id the edge points at; for {@link EdgeKind#DEPENDS_ON} it may not be a node
 * @param kind   relation
 */
public record PlanEdge(String source, String target, EdgeKind kind) {}
