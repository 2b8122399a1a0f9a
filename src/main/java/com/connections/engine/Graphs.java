package com.connections.engine;

/**
 * Factory for graphs whose kind is only known at runtime, such as graphs read
 * back from a snapshot.
 */
public final class Graphs {
    private Graphs() {
        // Utility class
    }

    public static AbstractGraph empty(Orientation orientation) {
        return switch (orientation) {
            case DIRECTED -> new DirectedGraph();
            case UNDIRECTED -> new UndirectedGraph();
        };
    }

    public static AbstractGraph create(Orientation orientation, Object nodes, Object edges) {
        return create(orientation, nodes, edges, LoadOptions.defaults());
    }

    public static AbstractGraph create(Orientation orientation, Object nodes, Object edges, LoadOptions options) {
        return switch (orientation) {
            case DIRECTED -> new DirectedGraph(nodes, edges, options);
            case UNDIRECTED -> new UndirectedGraph(nodes, edges, options);
        };
    }
}
