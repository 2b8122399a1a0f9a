package com.connections.engine;

import com.connections.api.Couple;
import com.connections.api.Edges;
import com.connections.api.ErrorKind;
import com.connections.api.GraphDescription;
import com.connections.api.GraphException;
import com.connections.api.Identifier;
import com.connections.api.Nodes;
import com.connections.util.GraphExplain;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Multigraph engine shared by {@link DirectedGraph} and {@link UndirectedGraph}.
 *
 * <h2>Stores</h2>
 * A graph owns one node store (identifier -> attributes) and one edge store
 * (couple -> edge identifier -> attributes). Both are exposed as read-only
 * views; they change only through the mutation methods below.
 *
 * <h2>Calculated attributes</h2>
 * Degree and neighbor set are derived from the edge store and kept in a
 * {@link CalculatedAttributes} holder:
 * <ul>
 * <li>degree(v) is the sum, over every couple touching v, of that couple's
 * number of parallel edges. Both endpoints count, so a directed degree is
 * in-degree plus out-degree and a loop counts twice.</li>
 * <li>neighbors(v) follows the {@link Orientation}: successors for a directed
 * graph, every adjacent node for an undirected one.</li>
 * </ul>
 * Mutations accept a {@code recalculate} flag. Passing false defers the O(V+E)
 * pass so that bulk callers pay it once; until the next
 * {@link #recalculate()} the values are stale and {@link #isStale()} says so.
 *
 * <h2>Thread Safety</h2>
 * None. A graph shared between threads must be guarded by the caller.
 */
@Log4j2
public abstract class AbstractGraph {
    private final Orientation orientation;
    private final NodeStore nodes = new NodeStore();
    private final EdgeStore edges = new EdgeStore();
    private final CalculatedAttributes calculated = new CalculatedAttributes();

    protected AbstractGraph(Orientation orientation) {
        this(orientation, null, null, LoadOptions.defaults());
    }

    /**
     * Validates and loads bulk input, then runs one degree/neighbor pass unless
     * the options disable it.
     *
     * @param rawNodes node input, see {@link GraphLoader}; may be null
     * @param rawEdges edge input, see {@link GraphLoader}; may be null
     * @throws GraphException a validation kind if the input is malformed
     */
    protected AbstractGraph(Orientation orientation, Object rawNodes, Object rawEdges, LoadOptions options) {
        this.orientation = orientation;
        new GraphLoader(this, options).load(rawNodes, rawEdges);
        if (options.recalculate())
            recalculate();
    }

    public final Orientation orientation() {
        return orientation;
    }

    public final Nodes nodes() {
        return nodes;
    }

    public final Edges edges() {
        return edges;
    }

    /** Number of nodes. */
    public final int size() {
        return nodes.size();
    }

    /**
     * The canonical couple this graph stores an edge between two endpoints under.
     *
     * @throws IllegalArgumentException if either endpoint is null
     */
    public final Couple couple(Identifier left, Identifier right) {
        if (left == null || right == null)
            throw new IllegalArgumentException("Edge endpoints must not be null: (" + left + ", " + right + ")");
        return orientation.couple(left, right);
    }

    /** Parallel edges between two endpoints, looked up through canonicalization. */
    public final Map<Identifier, Map<String, Object>> multiples(Identifier left, Identifier right) {
        return edges.multiples(couple(left, right));
    }

    // ── Nodes ────────────────────────────────────────────────────

    /** Adds a node with a generated identifier and no attributes. */
    public final Identifier addNode() {
        return addNode(null, false, Map.of());
    }

    public final Identifier addNode(Map<String, Object> attributes) {
        return addNode(null, false, attributes);
    }

    public final Identifier addNode(Identifier identifier) {
        return addNode(identifier, false, Map.of());
    }

    public final Identifier addNode(Identifier identifier, Map<String, Object> attributes) {
        return addNode(identifier, false, attributes);
    }

    /**
     * Adds a node, or replaces the attributes of an existing one.
     *
     * Replacing keeps the node's calculated attributes and overwrites its
     * attribute record as a whole. No recomputation is performed; a new node
     * makes the calculated attributes stale.
     *
     * @param identifier node identifier, or null to generate one
     * @param replace    whether an existing node may be replaced
     * @param attributes attribute record, copied; null means none
     * @return the node identifier
     * @throws GraphException NODE_ALREADY_EXISTS if the node exists and
     *                        replace is false
     */
    public final Identifier addNode(Identifier identifier, boolean replace, Map<String, Object> attributes) {
        Identifier node = identifier != null ? identifier : Identifier.generate();
        if (nodes.contains(node)) {
            if (!replace)
                throw GraphException.of(ErrorKind.NODE_ALREADY_EXISTS, node);
        } else {
            calculated.markStale();
        }
        nodes.put(node, copy(attributes));
        return node;
    }

    public final void delNode(Identifier identifier) {
        delNode(identifier, true);
    }

    /**
     * Removes a node and every couple incident to it, in either endpoint
     * position.
     *
     * @throws GraphException NODE_NOT_FOUND if the node does not exist
     */
    public final void delNode(Identifier identifier, boolean recalculate) {
        if (!nodes.contains(identifier))
            throw GraphException.of(ErrorKind.NODE_NOT_FOUND, identifier);

        List<Couple> incident = edges.couples().stream()
                .filter(couple -> couple.contains(identifier))
                .collect(Collectors.toList());
        incident.forEach(edges::remove);
        nodes.remove(identifier);

        afterMutation(recalculate);
    }

    /**
     * Removes every node. Edges are kept, so couples may afterwards reference
     * absent nodes; recomputation ignores such endpoints. Use
     * {@link #clearEdges()} first for an empty graph.
     */
    public final void clearNodes() {
        if (!edges.isEmpty())
            log.warn("Clearing {} nodes of a {} leaves {} couples referencing absent nodes",
                    nodes.size(), orientation.typeName(), edges.size());
        nodes.clear();
        calculated.clear();
    }

    // ── Edges ────────────────────────────────────────────────────

    /** Adds an edge with a generated identifier and no attributes. */
    public final Identifier addEdge(Identifier left, Identifier right) {
        return addEdge(left, right, null, false, true, true, Map.of());
    }

    public final Identifier addEdge(Identifier left, Identifier right, Map<String, Object> attributes) {
        return addEdge(left, right, null, false, true, true, attributes);
    }

    public final Identifier addEdge(Identifier left, Identifier right, Identifier identifier,
            Map<String, Object> attributes) {
        return addEdge(left, right, identifier, false, true, true, attributes);
    }

    /**
     * Adds an edge, or replaces the attributes of an existing one.
     *
     * @param left                    left endpoint
     * @param right                   right endpoint
     * @param identifier              edge identifier, or null to generate one
     * @param replace                 whether an existing edge may be replaced
     * @param addMissingIncidentNodes create endpoints that are not nodes yet
     * @param recalculate             run the degree/neighbor pass now
     * @param attributes              attribute record, copied; null means none
     * @return the edge identifier
     * @throws GraphException EDGE_ALREADY_EXISTS if the couple already holds
     *                        this identifier and replace is false
     */
    public final Identifier addEdge(Identifier left, Identifier right, Identifier identifier, boolean replace,
            boolean addMissingIncidentNodes, boolean recalculate, Map<String, Object> attributes) {
        Couple couple = couple(left, right);
        Identifier edge = identifier != null ? identifier : Identifier.generate();

        if (edges.contains(couple, edge) && !replace)
            throw GraphException.of(ErrorKind.EDGE_ALREADY_EXISTS, couple, edge);
        edges.put(couple, edge, copy(attributes));

        if (addMissingIncidentNodes) {
            if (!nodes.contains(left))
                nodes.put(left, new LinkedHashMap<>());
            if (!nodes.contains(right))
                nodes.put(right, new LinkedHashMap<>());
        }

        afterMutation(recalculate);
        return edge;
    }

    /** Removes every parallel edge between two endpoints. */
    public final void delEdge(Identifier left, Identifier right) {
        delEdge(left, right, null, true);
    }

    public final void delEdge(Identifier left, Identifier right, Identifier identifier) {
        delEdge(left, right, identifier, true);
    }

    /**
     * Removes one edge, or the whole couple when {@code identifier} is null.
     * Removing the last edge of a couple removes the couple.
     *
     * @throws GraphException COUPLE_NOT_FOUND or EDGE_NOT_FOUND
     */
    public final void delEdge(Identifier left, Identifier right, Identifier identifier, boolean recalculate) {
        Couple couple = couple(left, right);
        if (!edges.contains(couple))
            throw GraphException.of(ErrorKind.COUPLE_NOT_FOUND, couple);

        if (identifier == null) {
            edges.remove(couple);
        } else {
            if (!edges.contains(couple, identifier))
                throw GraphException.of(ErrorKind.EDGE_NOT_FOUND, couple, identifier);
            edges.remove(couple, identifier);
        }

        afterMutation(recalculate);
    }

    /** Removes every edge; every node ends with degree 0 and no neighbors. */
    public final void clearEdges() {
        edges.clear();
        clearDegree();
        clearNeighbors();
    }

    // ── Calculated attributes ────────────────────────────────────

    /** Recomputes degree and neighbors. O(V+E). */
    public final void recalculate() {
        calcDegree();
        calcNeighbors();
    }

    public final void calcDegree() {
        calculated.resetDegree(nodes.identifiers(), true);
        for (Couple couple : edges.couples()) {
            int multiplicity = edges.multiplicity(couple);
            calculated.addDegree(couple.left(), multiplicity);
            calculated.addDegree(couple.right(), multiplicity);
        }
    }

    public final void clearDegree() {
        calculated.resetDegree(nodes.identifiers(), edges.isEmpty());
    }

    public final void calcNeighbors() {
        calculated.resetNeighbors(nodes.identifiers(), true);
        for (Couple couple : edges.couples())
            orientation.linkNeighbors(couple, calculated::addNeighbor);
    }

    public final void clearNeighbors() {
        calculated.resetNeighbors(nodes.identifiers(), edges.isEmpty());
    }

    /** Degree as of the last recomputation. */
    public final int degree(Identifier node) {
        requireNode(node);
        return calculated.degree(node);
    }

    /** Neighbor set as of the last recomputation. Unmodifiable. */
    public final Set<Identifier> neighbors(Identifier node) {
        requireNode(node);
        return calculated.neighbors(node);
    }

    /** True when a deferred mutation happened after the last recomputation. */
    public final boolean isStale() {
        return calculated.isStale();
    }

    public final CalculatedAttributes calculatedAttributes() {
        return calculated;
    }

    // ── Projections ──────────────────────────────────────────────

    public final AbstractGraph getSubgraph(Collection<Identifier> selected) {
        return getSubgraph(selected, true);
    }

    /**
     * Extracts a new graph of the same kind.
     *
     * A couple, with all its parallel edges, is kept when both endpoints
     * (fullmatch) or at least one endpoint (not fullmatch) are selected. The
     * endpoints of kept couples are copied with their attributes; a selected
     * node without a kept couple is not part of the result. Identifiers that
     * are not nodes of this graph are ignored.
     */
    public final AbstractGraph getSubgraph(Collection<Identifier> selected, boolean fullmatch) {
        Set<Identifier> selection = new HashSet<>(selected);
        selection.retainAll(nodes.identifiers());

        AbstractGraph subgraph = Graphs.empty(orientation);
        edges.forEach((couple, multiples) -> {
            boolean l = selection.contains(couple.left());
            boolean r = selection.contains(couple.right());
            if (fullmatch ? !(l && r) : !(l || r))
                return;
            multiples.forEach((edge, attributes) -> subgraph.addEdge(couple.left(), couple.right(), edge,
                    false, false, false, attributes));
            copyNodeInto(subgraph, couple.left());
            copyNodeInto(subgraph, couple.right());
        });
        subgraph.recalculate();

        log.debug("Extracted subgraph with {} nodes and {} couples from a selection of {} (fullmatch={})",
                subgraph.size(), subgraph.edges().size(), selection.size(), fullmatch);
        return subgraph;
    }

    /** Recomputes the calculated attributes, then summarizes the structure. */
    public final GraphDescription describe() {
        recalculate();
        return structure();
    }

    /** Loop couples, recomputed from the edge store on every iteration. */
    public final Iterable<Couple> findLoops() {
        return () -> edges.couples().stream().filter(Couple::isLoop).iterator();
    }

    public final boolean isMultiGraph() {
        for (Couple couple : edges.couples())
            if (edges.multiplicity(couple) > 1)
                return true;
        return false;
    }

    public final boolean isPseudoGraph() {
        return findLoops().iterator().hasNext();
    }

    /**
     * Distinct non-loop node pairs, direction ignored, against
     * n * (n - 1) / 2.
     */
    public final boolean isCompleteGraph() {
        long pairs = edges.couples().stream()
                .filter(couple -> !couple.isLoop())
                .map(couple -> Orientation.UNDIRECTED.couple(couple.left(), couple.right()))
                .distinct()
                .count();
        long n = nodes.size();
        return pairs == n * (n - 1) / 2;
    }

    // ── Object ───────────────────────────────────────────────────

    /** Same concrete kind, same node records and same edge records. */
    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AbstractGraph other = (AbstractGraph) o;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public final int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    /** For example "Multi Directed Graph with 3 nodes and 2 edges". */
    @Override
    public String toString() {
        return GraphExplain.summarize(structure());
    }

    // ── Internals ────────────────────────────────────────────────

    private GraphDescription structure() {
        return new GraphDescription(orientation.typeName(), nodes.size(), edges.size(),
                isMultiGraph(), isPseudoGraph(), isCompleteGraph());
    }

    private void afterMutation(boolean recalculate) {
        if (recalculate)
            recalculate();
        else
            calculated.markStale();
    }

    private void requireNode(Identifier node) {
        if (!nodes.contains(node))
            throw GraphException.of(ErrorKind.NODE_NOT_FOUND, node);
    }

    private void copyNodeInto(AbstractGraph target, Identifier node) {
        if (nodes.contains(node) && !target.nodes.contains(node))
            target.addNode(node, false, nodes.attributes(node));
    }

    private static Map<String, Object> copy(Map<String, Object> attributes) {
        return attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }
}
