package com.connections.api;

import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Read-only view of a graph's edge store: couple -> (edge identifier ->
 * attributes).
 *
 * Lookups take an already canonical {@link Couple}; use the graph's
 * {@code couple(left, right)} to canonicalize a pair of endpoints first.
 */
public interface Edges {

    /** Number of distinct couples, not counting parallel edges. */
    int size();

    boolean isEmpty();

    /** Number of edges, counting every parallel edge. */
    int edgeCount();

    boolean contains(Couple couple);

    boolean contains(Couple couple, Identifier edge);

    /** Couples in insertion order. The returned set is unmodifiable. */
    Set<Couple> couples();

    /**
     * Parallel edges of a couple keyed by edge identifier.
     *
     * @return an unmodifiable view, empty if the couple does not exist
     */
    Map<Identifier, Map<String, Object>> multiples(Couple couple);

    /**
     * Attribute record of one edge.
     *
     * @throws GraphException COUPLE_NOT_FOUND or EDGE_NOT_FOUND
     */
    Map<String, Object> attributes(Couple couple, Identifier edge);

    void forEach(BiConsumer<Couple, Map<Identifier, Map<String, Object>>> action);
}
