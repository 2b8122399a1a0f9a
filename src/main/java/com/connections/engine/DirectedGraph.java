package com.connections.engine;

/**
 * Directed multigraph: (a, b) and (b, a) are different couples, and the
 * neighbors of a node are its successors.
 *
 * <pre>
 * DirectedGraph g = new DirectedGraph();
 * g.addEdge(Identifier.of("Sebastian"), Identifier.of("Elizabeth"), Map.of("amount", 1400));
 * g.neighbors(Identifier.of("Sebastian")); // [Elizabeth]
 * g.neighbors(Identifier.of("Elizabeth")); // []
 * </pre>
 */
public final class DirectedGraph extends AbstractGraph {

    public DirectedGraph() {
        super(Orientation.DIRECTED);
    }

    /**
     * Bulk-loads nodes and edges.
     *
     * @param nodes a Map of identifier to attributes or an Iterable of identifiers; may be null
     * @param edges a Map of couple to (edge identifier to attributes) or an Iterable of couples; may be null
     */
    public DirectedGraph(Object nodes, Object edges) {
        super(Orientation.DIRECTED, nodes, edges, LoadOptions.defaults());
    }

    public DirectedGraph(Object nodes, Object edges, LoadOptions options) {
        super(Orientation.DIRECTED, nodes, edges, options);
    }
}
