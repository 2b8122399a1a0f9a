package com.connections.engine;

import com.connections.api.Couple;
import com.connections.api.Edges;
import com.connections.api.ErrorKind;
import com.connections.api.GraphException;
import com.connections.api.Identifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Edge store: couple -> (edge identifier -> attribute record).
 *
 * A couple is present only while it holds at least one edge; removing its last
 * edge removes the couple.
 */
final class EdgeStore implements Edges {
    private final Map<Couple, Map<Identifier, Map<String, Object>>> couples = new LinkedHashMap<>();
    private int edgeCount;

    @Override
    public int size() {
        return couples.size();
    }

    @Override
    public boolean isEmpty() {
        return couples.isEmpty();
    }

    @Override
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public boolean contains(Couple couple) {
        return couples.containsKey(couple);
    }

    @Override
    public boolean contains(Couple couple, Identifier edge) {
        Map<Identifier, Map<String, Object>> multiples = couples.get(couple);
        return multiples != null && multiples.containsKey(edge);
    }

    @Override
    public Set<Couple> couples() {
        return Collections.unmodifiableSet(couples.keySet());
    }

    @Override
    public Map<Identifier, Map<String, Object>> multiples(Couple couple) {
        Map<Identifier, Map<String, Object>> multiples = couples.get(couple);
        return multiples == null ? Map.of() : Collections.unmodifiableMap(multiples);
    }

    @Override
    public Map<String, Object> attributes(Couple couple, Identifier edge) {
        Map<Identifier, Map<String, Object>> multiples = couples.get(couple);
        if (multiples == null)
            throw GraphException.of(ErrorKind.COUPLE_NOT_FOUND, couple);
        Map<String, Object> attributes = multiples.get(edge);
        if (attributes == null)
            throw GraphException.of(ErrorKind.EDGE_NOT_FOUND, couple, edge);
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public void forEach(BiConsumer<Couple, Map<Identifier, Map<String, Object>>> action) {
        couples.forEach((couple, multiples) -> action.accept(couple, Collections.unmodifiableMap(multiples)));
    }

    /** Number of parallel edges of a couple, 0 if absent. */
    int multiplicity(Couple couple) {
        Map<Identifier, Map<String, Object>> multiples = couples.get(couple);
        return multiples == null ? 0 : multiples.size();
    }

    void put(Couple couple, Identifier edge, Map<String, Object> attributes) {
        Map<Identifier, Map<String, Object>> multiples = couples.computeIfAbsent(couple, c -> new LinkedHashMap<>());
        if (multiples.put(edge, attributes) == null)
            edgeCount++;
    }

    void remove(Couple couple) {
        Map<Identifier, Map<String, Object>> removed = couples.remove(couple);
        if (removed != null)
            edgeCount -= removed.size();
    }

    void remove(Couple couple, Identifier edge) {
        Map<Identifier, Map<String, Object>> multiples = couples.get(couple);
        if (multiples == null || multiples.remove(edge) == null)
            return;
        edgeCount--;
        if (multiples.isEmpty())
            couples.remove(couple);
    }

    void clear() {
        couples.clear();
        edgeCount = 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EdgeStore other && couples.equals(other.couples);
    }

    @Override
    public int hashCode() {
        return couples.hashCode();
    }

    @Override
    public String toString() {
        return couples.toString();
    }
}
