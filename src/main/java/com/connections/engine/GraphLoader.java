package com.connections.engine;

import com.connections.api.Couple;
import com.connections.api.ErrorKind;
import com.connections.api.GraphException;
import com.connections.api.Identifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Validation pipeline for bulk node and edge input.
 *
 * Accepted node input:
 * <ul>
 * <li>a {@code Map} of identifier -> attribute map</li>
 * <li>an {@code Iterable} of identifiers (empty attributes)</li>
 * </ul>
 * Accepted edge input:
 * <ul>
 * <li>a {@code Map} of couple -> (edge identifier -> attribute map)</li>
 * <li>an {@code Iterable} of couples (one generated edge each)</li>
 * </ul>
 * A couple is a {@link Couple}, a two-element {@code List} or a two-element
 * array. Identifiers are anything {@link Identifier#isAdmissible(Object)}
 * accepts.
 *
 * Both inputs are checked completely, phase by phase, before the first node is
 * inserted. Duplicate edge identifiers only show up during insertion, so such
 * a failure leaves the graph partially loaded.
 */
@Log4j2
final class GraphLoader {
    private final AbstractGraph graph;
    private final LoadOptions options;

    private record NodeEntry(Identifier node, boolean replace, Map<String, Object> attributes) {
    }

    /** edge == null means "generate one". */
    private record EdgeEntry(Identifier left, Identifier right, Identifier edge, Map<String, Object> attributes) {
    }

    GraphLoader(AbstractGraph graph, LoadOptions options) {
        this.graph = graph;
        this.options = options;
    }

    void load(Object rawNodes, Object rawEdges) {
        List<NodeEntry> nodes = validateNodes(rawNodes);
        List<EdgeEntry> edges = validateEdges(rawEdges);

        for (NodeEntry entry : nodes)
            graph.addNode(entry.node(), entry.replace(), entry.attributes());

        for (EdgeEntry entry : edges) {
            if (entry.edge() == null) {
                graph.addEdge(entry.left(), entry.right(), null, false, true, false, entry.attributes());
                continue;
            }
            try {
                graph.addEdge(entry.left(), entry.right(), entry.edge(), false, true, false, entry.attributes());
            } catch (GraphException e) {
                if (e.kind() != ErrorKind.EDGE_ALREADY_EXISTS)
                    throw e;
                throw GraphException.of(ErrorKind.DUPLICATION_IN_EDGE_IDENTIFIERS, e.couple(), e);
            }
        }
        log.debug("Loaded {} node entries and {} edge entries into {}", nodes.size(), edges.size(),
                graph.orientation().typeName());
    }

    // ── Nodes ────────────────────────────────────────────────────

    private List<NodeEntry> validateNodes(Object raw) {
        if (raw == null)
            return List.of();

        List<NodeEntry> entries = new ArrayList<>();
        if (raw instanceof Map<?, ?> map) {
            for (Object key : map.keySet())
                requireIdentifier(key, ErrorKind.WRONG_TYPE_OF_NODE_IDENTIFIER);
            for (Object value : map.values())
                requireAttributes(value, ErrorKind.WRONG_TYPE_OF_NODE_ATTRIBUTES);
            map.forEach((key, value) -> entries.add(new NodeEntry(Identifier.from(key), false, attributes(value))));
        } else if (raw instanceof Iterable<?> items) {
            for (Object item : items)
                requireIdentifier(item, ErrorKind.WRONG_TYPE_OF_NODE_IDENTIFIER);
            for (Object item : items)
                entries.add(new NodeEntry(Identifier.from(item), true, new LinkedHashMap<>()));
        } else {
            throw GraphException.withDetail(ErrorKind.WRONG_TYPE_OF_NODES, raw.getClass().getName());
        }
        return entries;
    }

    // ── Edges ────────────────────────────────────────────────────

    private List<EdgeEntry> validateEdges(Object raw) {
        if (raw == null)
            return List.of();

        List<EdgeEntry> entries = new ArrayList<>();
        if (raw instanceof Map<?, ?> map) {
            List<List<?>> couples = validateCouples(map.keySet());
            List<Object> multiples = new ArrayList<>(map.values());

            for (Object value : multiples)
                if (!(value instanceof Map))
                    throw GraphException.withDetail(ErrorKind.WRONG_TYPE_OF_MULTIPLE_EDGES, String.valueOf(value));
            if (options.emptyMultiples() == LoadOptions.EmptyMultiples.REJECT) {
                for (int i = 0; i < multiples.size(); i++)
                    if (((Map<?, ?>) multiples.get(i)).isEmpty())
                        throw GraphException.withDetail(ErrorKind.WRONG_LENGTH_OF_MULTIPLE_EDGES,
                                String.valueOf(couples.get(i)));
            }
            for (Object value : multiples)
                for (Object edge : ((Map<?, ?>) value).keySet())
                    requireIdentifier(edge, ErrorKind.WRONG_TYPE_OF_EDGE_IDENTIFIER);
            for (Object value : multiples)
                for (Object attributes : ((Map<?, ?>) value).values())
                    requireAttributes(attributes, ErrorKind.WRONG_TYPE_OF_EDGE_ATTRIBUTES);

            for (int i = 0; i < couples.size(); i++) {
                Identifier left = Identifier.from(couples.get(i).get(0));
                Identifier right = Identifier.from(couples.get(i).get(1));
                Map<?, ?> edges = (Map<?, ?>) multiples.get(i);
                if (edges.isEmpty()) {
                    entries.add(new EdgeEntry(left, right, null, new LinkedHashMap<>()));
                    continue;
                }
                edges.forEach((edge, attributes) -> entries.add(
                        new EdgeEntry(left, right, Identifier.from(edge), attributes(attributes))));
            }
        } else if (raw instanceof Iterable<?> items) {
            List<Object> keys = new ArrayList<>();
            items.forEach(keys::add);
            for (List<?> couple : validateCouples(keys))
                entries.add(new EdgeEntry(Identifier.from(couple.get(0)), Identifier.from(couple.get(1)),
                        null, new LinkedHashMap<>()));
        } else {
            throw GraphException.withDetail(ErrorKind.WRONG_TYPE_OF_EDGES, raw.getClass().getName());
        }
        return entries;
    }

    /** Shape, then length, then endpoint types, each over all couples. */
    private static List<List<?>> validateCouples(Iterable<?> rawCouples) {
        List<List<?>> couples = new ArrayList<>();
        for (Object raw : rawCouples) {
            if (raw instanceof Couple c)
                couples.add(List.of(c.left(), c.right()));
            else if (raw instanceof List<?> list)
                couples.add(list);
            else if (raw instanceof Object[] array)
                couples.add(Arrays.asList(array));
            else
                throw GraphException.withDetail(ErrorKind.WRONG_TYPE_OF_COUPLE, String.valueOf(raw));
        }
        for (List<?> couple : couples)
            if (couple.size() != 2)
                throw GraphException.withDetail(ErrorKind.WRONG_LENGTH_OF_COUPLE, String.valueOf(couple));
        for (List<?> couple : couples)
            if (!Identifier.isAdmissible(couple.get(0)) || !Identifier.isAdmissible(couple.get(1)))
                throw GraphException.withDetail(ErrorKind.WRONG_TYPE_OF_NODE_IDENTIFIER_IN_COUPLE,
                        String.valueOf(couple));
        return couples;
    }

    // ── Helpers ──────────────────────────────────────────────────

    private static void requireIdentifier(Object raw, ErrorKind kind) {
        if (!Identifier.isAdmissible(raw))
            throw GraphException.withDetail(kind, String.valueOf(raw));
    }

    private static void requireAttributes(Object raw, ErrorKind kind) {
        if (!(raw instanceof Map<?, ?> map))
            throw GraphException.withDetail(kind, String.valueOf(raw));
        for (Object key : map.keySet())
            if (!(key instanceof String))
                throw GraphException.withDetail(kind, String.valueOf(key));
    }

    private static Map<String, Object> attributes(Object validated) {
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<?, ?>) validated).forEach((key, value) -> copy.put((String) key, value));
        return copy;
    }
}
