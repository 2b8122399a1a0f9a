package com.connections.util;

import com.connections.api.Couple;
import com.connections.api.GraphDescription;
import com.connections.api.Identifier;
import com.connections.engine.AbstractGraph;
import com.connections.engine.Orientation;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic utility for inspecting graph structure and node state.
 *
 * <p>
 * Generates human-readable text: a one-line summary, a per-node explanation,
 * a full topology dump and a Mermaid diagram.
 *
 * <p>
 * <b>Usage:</b> intended for debugging, logging and {@code toString()}. Every
 * method walks the whole graph; calculated attributes are printed as they are,
 * stale or not.
 */
public final class GraphExplain {
    private final AbstractGraph graph;

    public GraphExplain(AbstractGraph graph) {
        this.graph = graph;
    }

    /**
     * One-line summary such as "Complete Pseudo Multi Undirected Graph with 3
     * nodes and 4 edges". Edges are counted as distinct couples.
     */
    public static String summarize(GraphDescription description) {
        String type = description.type();
        if (description.isMultiGraph())
            type = "Multi " + type;
        if (description.isPseudoGraph())
            type = "Pseudo " + type;
        if (description.isCompleteGraph())
            type = "Complete " + type;

        int n = description.numberOfNodes();
        int e = description.numberOfEdges();
        return type + " with " + n + (n > 1 ? " nodes" : " node")
                + " and " + e + (e > 1 ? " edges" : " edge");
    }

    /**
     * Dumps attributes and calculated state of a single node.
     */
    public String explainNode(Identifier node) {
        Map<String, Object> attributes = graph.nodes().attributes(node);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node).append('\n')
                .append("  Attributes: ").append(attributes).append('\n')
                .append("  Degree: ").append(graph.degree(node)).append('\n')
                .append("  Neighbors: ").append(graph.neighbors(node)).append('\n');
        if (graph.isStale())
            sb.append("  (calculated attributes are stale)\n");
        return sb.toString();
    }

    /**
     * Dumps every couple with its parallel edge identifiers.
     */
    public String dumpTopology() {
        String arrow = graph.orientation() == Orientation.DIRECTED ? " -> " : " -- ";
        StringBuilder sb = new StringBuilder(1024);
        sb.append(summarize(graph.describe())).append(":\n");
        graph.nodes().forEach((node, attributes) -> sb.append("  ").append(node)
                .append(" (degree ").append(graph.degree(node)).append(")\n"));
        graph.edges().forEach((couple, multiples) -> sb.append("  ").append(couple.left()).append(arrow)
                .append(couple.right()).append(' ').append(multiples.keySet()).append('\n'));
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS flowchart.
     * <p>
     * Nodes are declared first, then one link per couple labelled with its
     * number of parallel edges when greater than one. Every identifier gets
     * its own Mermaid id; when two identifiers sanitize to the same text the
     * later one is suffixed with a counter.
     * </p>
     */
    public String toMermaid() {
        String link = graph.orientation() == Orientation.DIRECTED ? "-->" : "---";
        Map<Identifier, String> ids = new HashMap<>();
        Set<String> used = new HashSet<>();
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        for (Identifier node : graph.nodes().identifiers())
            sb.append("  ").append(mermaidId(node, ids, used)).append("[\"").append(label(node)).append("\"];\n");

        for (Couple couple : graph.edges().couples()) {
            int count = graph.edges().multiples(couple).size();
            sb.append("  ").append(mermaidId(couple.left(), ids, used)).append(' ').append(link);
            if (count > 1)
                sb.append("|x").append(count).append('|');
            sb.append(' ').append(mermaidId(couple.right(), ids, used)).append(";\n");
        }
        return sb.toString();
    }

    private static String mermaidId(Identifier node, Map<Identifier, String> ids, Set<String> used) {
        String id = ids.get(node);
        if (id != null)
            return id;
        String base = sanitize(node);
        id = base;
        for (int i = 1; !used.add(id); i++)
            id = base + "_" + i;
        ids.put(node, id);
        return id;
    }

    private static String sanitize(Identifier node) {
        String safe = node.toString().replaceAll("[^a-zA-Z0-9_]", "_");
        return node.isNumeric() || safe.isEmpty() ? "n" + safe : safe;
    }

    private static String label(Identifier node) {
        return node.toString().replace("\"", "#quot;");
    }
}
