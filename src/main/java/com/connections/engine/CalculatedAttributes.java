package com.connections.engine;

import com.connections.api.Identifier;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derived per-node state: degree and neighbor set.
 *
 * Values are only accurate right after a recomputation. Every deferred
 * mutation of the graph marks the holder stale; {@link #isStale()} tells the
 * caller whether a recomputation is due.
 *
 * Endpoints that have no node record (edges added with
 * addMissingIncidentNodes=false, or left behind by clearNodes) are skipped.
 */
public final class CalculatedAttributes {
    private final Map<Identifier, Integer> degree = new HashMap<>();
    private final Map<Identifier, Set<Identifier>> neighbors = new HashMap<>();
    private boolean degreeStale;
    private boolean neighborsStale;

    public int degree(Identifier node) {
        return degree.getOrDefault(node, 0);
    }

    public Set<Identifier> neighbors(Identifier node) {
        Set<Identifier> set = neighbors.get(node);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    public boolean isStale() {
        return degreeStale || neighborsStale;
    }

    public boolean isDegreeStale() {
        return degreeStale;
    }

    public boolean isNeighborsStale() {
        return neighborsStale;
    }

    void markStale() {
        degreeStale = true;
        neighborsStale = true;
    }

    /** Every node gets degree 0. The result is accurate only for an edgeless graph. */
    void resetDegree(Collection<Identifier> nodes, boolean accurate) {
        degree.clear();
        for (Identifier node : nodes)
            degree.put(node, 0);
        degreeStale = !accurate;
    }

    void addDegree(Identifier node, int count) {
        degree.computeIfPresent(node, (n, d) -> d + count);
    }

    /** Every node gets an empty neighbor set. The result is accurate only for an edgeless graph. */
    void resetNeighbors(Collection<Identifier> nodes, boolean accurate) {
        neighbors.clear();
        for (Identifier node : nodes)
            neighbors.put(node, new LinkedHashSet<>());
        neighborsStale = !accurate;
    }

    void addNeighbor(Identifier node, Identifier neighbor) {
        Set<Identifier> set = neighbors.get(node);
        if (set != null)
            set.add(neighbor);
    }

    void clear() {
        degree.clear();
        neighbors.clear();
        degreeStale = false;
        neighborsStale = false;
    }
}
