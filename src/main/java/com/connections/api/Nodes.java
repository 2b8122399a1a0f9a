package com.connections.api;

import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Read-only view of a graph's node store.
 *
 * The view offers no way to mutate or drop the store. Nodes are added and
 * removed through the graph; the whole store is emptied only by
 * {@code clearNodes()}.
 */
public interface Nodes {

    int size();

    boolean isEmpty();

    boolean contains(Identifier node);

    /** Identifiers in insertion order. The returned set is unmodifiable. */
    Set<Identifier> identifiers();

    /**
     * Attribute record of a node. Calculated attributes are not part of the
     * record; read them through the graph.
     *
     * @return an unmodifiable view of the attributes
     * @throws GraphException NODE_NOT_FOUND if the node does not exist
     */
    Map<String, Object> attributes(Identifier node);

    void forEach(BiConsumer<Identifier, Map<String, Object>> action);
}
