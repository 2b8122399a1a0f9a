package com.connections.engine;

/**
 * Undirected multigraph: (a, b) and (b, a) are stored under the same couple,
 * lower identifier first, and neighbor sets are symmetric.
 */
public final class UndirectedGraph extends AbstractGraph {

    public UndirectedGraph() {
        super(Orientation.UNDIRECTED);
    }

    /**
     * Bulk-loads nodes and edges.
     *
     * @param nodes a Map of identifier to attributes or an Iterable of identifiers; may be null
     * @param edges a Map of couple to (edge identifier to attributes) or an Iterable of couples; may be null
     */
    public UndirectedGraph(Object nodes, Object edges) {
        super(Orientation.UNDIRECTED, nodes, edges, LoadOptions.defaults());
    }

    public UndirectedGraph(Object nodes, Object edges, LoadOptions options) {
        super(Orientation.UNDIRECTED, nodes, edges, options);
    }
}
