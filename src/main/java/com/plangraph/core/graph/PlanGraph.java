package com.plangraph.core.graph;

import com.plangraph.core.model.PlanNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable directed graph of plan nodes.
 * <p>
 * Nodes live in an arena keyed by id, in insertion order. Edges are kept in
 * insertion order as well, with per-kind outgoing and incoming adjacency so
 * that successor and predecessor lookups cost O(degree). Edge targets are not
 * required to be nodes: a dependency on an unknown id is recorded as an edge
 * only.
 */
public final class PlanGraph {

    private static final PlanGraph EMPTY = new Builder().build();

    private final Map<String, PlanNode> nodes;
    private final List<PlanEdge> edges;
    private final Map<EdgeKind, Map<String, List<String>>> outgoing;
    private final Map<EdgeKind, Map<String, List<String>>> incoming;

    private PlanGraph(Map<String, PlanNode> nodes, Collection<PlanEdge> edges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.outgoing = new EnumMap<>(EdgeKind.class);
        this.incoming = new EnumMap<>(EdgeKind.class);
        for (EdgeKind kind : EdgeKind.values()) {
            outgoing.put(kind, new LinkedHashMap<>());
            incoming.put(kind, new LinkedHashMap<>());
        }
        for (PlanEdge edge : this.edges) {
            outgoing.get(edge.kind()).computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            incoming.get(edge.kind()).computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
        }
    }

    public static PlanGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Existence-checked lookup.
     */
    public Optional<PlanNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    /** Nodes in insertion order. */
    public Collection<PlanNode> nodes() {
        return nodes.values();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    /** Edges in insertion order. */
    public List<PlanEdge> edges() {
        return edges;
    }

    /**
     * Targets of the edges of the given kind leaving {@code id}.
     */
    public List<String> successors(String id, EdgeKind kind) {
        return Collections.unmodifiableList(outgoing.get(kind).getOrDefault(id, List.of()));
    }

    /**
     * Sources of the edges of the given kind arriving at {@code id}.
     */
    public List<String> predecessors(String id, EdgeKind kind) {
        return Collections.unmodifiableList(incoming.get(kind).getOrDefault(id, List.of()));
    }

    public boolean hasEdge(String source, String target, EdgeKind kind) {
        return successors(source, kind).contains(target);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Collects nodes and edges for a single build. Not reusable after
     * {@link #build()}.
     */
    public static final class Builder {

        private final Map<String, PlanNode> nodes = new LinkedHashMap<>();
        private final Set<PlanEdge> edges = new LinkedHashSet<>();

        private Builder() {}

        public Builder addNode(PlanNode node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            return this;
        }

        /**
         * Adds an edge. Re-adding an identical edge is a no-op.
         */
        public Builder addEdge(String source, String target, EdgeKind kind) {
            edges.add(new PlanEdge(source, target, kind));
            return this;
        }

        public PlanGraph build() {
            return new PlanGraph(nodes, edges);
        }
    }
}
