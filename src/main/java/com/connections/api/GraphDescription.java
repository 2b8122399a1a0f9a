package com.connections.api;

import java.util.Optional;

/**
 * Structural summary of a graph, produced by {@code describe()}.
 *
 * The summary is a snapshot: it does not follow later mutations of the graph.
 */
public final class GraphDescription {
    private final String type;
    private final int numberOfNodes;
    private final int numberOfEdges;
    private final boolean multiGraph;
    private final boolean pseudoGraph;
    private final boolean completeGraph;

    public GraphDescription(String type, int numberOfNodes, int numberOfEdges,
            boolean multiGraph, boolean pseudoGraph, boolean completeGraph) {
        this.type = type;
        this.numberOfNodes = numberOfNodes;
        this.numberOfEdges = numberOfEdges;
        this.multiGraph = multiGraph;
        this.pseudoGraph = pseudoGraph;
        this.completeGraph = completeGraph;
    }

    /** "Directed Graph" or "Undirected Graph". */
    public String type() {
        return type;
    }

    public int numberOfNodes() {
        return numberOfNodes;
    }

    /** Number of distinct couples; parallel edges are not counted. */
    public int numberOfEdges() {
        return numberOfEdges;
    }

    /** At least one couple carries more than one edge. */
    public boolean isMultiGraph() {
        return multiGraph;
    }

    /** At least one loop exists. */
    public boolean isPseudoGraph() {
        return pseudoGraph;
    }

    /**
     * The number of distinct non-loop node pairs equals n * (n - 1) / 2.
     * Direction is ignored, so A->B alone makes the pair {A, B} connected.
     */
    public boolean isCompleteGraph() {
        return completeGraph;
    }

    /**
     * Connectivity is not computed by the graph itself; always empty.
     */
    public Optional<Boolean> isConnected() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "GraphDescription{type=" + type
                + ", numberOfNodes=" + numberOfNodes
                + ", numberOfEdges=" + numberOfEdges
                + ", multiGraph=" + multiGraph
                + ", pseudoGraph=" + pseudoGraph
                + ", completeGraph=" + completeGraph
                + ", connected=n/a}";
    }
}
