package com.connections.engine;

import com.connections.api.ErrorKind;
import com.connections.api.GraphException;
import com.connections.api.Identifier;
import com.connections.api.Nodes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Node store: identifier -> attribute record, in insertion order.
 * Mutators are package-private; callers outside the engine see {@link Nodes}.
 */
final class NodeStore implements Nodes {
    private final Map<Identifier, Map<String, Object>> records = new LinkedHashMap<>();

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public boolean contains(Identifier node) {
        return records.containsKey(node);
    }

    @Override
    public Set<Identifier> identifiers() {
        return Collections.unmodifiableSet(records.keySet());
    }

    @Override
    public Map<String, Object> attributes(Identifier node) {
        Map<String, Object> attributes = records.get(node);
        if (attributes == null)
            throw GraphException.of(ErrorKind.NODE_NOT_FOUND, node);
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public void forEach(BiConsumer<Identifier, Map<String, Object>> action) {
        records.forEach((node, attributes) -> action.accept(node, Collections.unmodifiableMap(attributes)));
    }

    void put(Identifier node, Map<String, Object> attributes) {
        records.put(node, attributes);
    }

    void remove(Identifier node) {
        records.remove(node);
    }

    void clear() {
        records.clear();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeStore other && records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return records.toString();
    }
}
