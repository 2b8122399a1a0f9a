package com.connections.io;

import com.connections.api.ErrorKind;
import com.connections.api.GraphException;
import com.connections.api.Identifier;
import com.connections.engine.AbstractGraph;
import com.connections.engine.Graphs;
import com.connections.engine.LoadOptions;
import com.connections.engine.Orientation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * JSON snapshot of a graph: its kind, node records and edge records.
 *
 * <p>
 * Calculated attributes are not written. On import the snapshot is turned
 * back into the bulk-input shapes the graph constructors accept (identifier ->
 * attributes, couple -> edge identifier -> attributes) and goes through the
 * same validation pipeline, so a malformed document fails with the usual
 * validation {@link ErrorKind}s.
 *
 * <p>
 * Export then import yields an equal graph, provided every couple endpoint is
 * a node. Couples left dangling by {@code clearNodes()} or by
 * {@code addEdge(..., addMissingIncidentNodes=false, ...)} do not survive: the
 * import creates their missing endpoints as nodes without attributes.
 *
 * <p>
 * Example:
 *
 * <pre>
 * {
 *   "type" : "DIRECTED",
 *   "nodes" : [ { "identifier" : "X", "attributes" : { "age" : 19 } } ],
 *   "edges" : [ { "couple" : [ "X", "Y" ],
 *                 "multiples" : [ { "identifier" : "e1", "attributes" : { } } ] } ]
 * }
 * </pre>
 */
@Log4j2
public final class JsonGraphCodec {
    private static final String EXTENSION = ".json";

    private final ObjectMapper mapper;
    private final LoadOptions loadOptions;

    public JsonGraphCodec() {
        this(new ObjectMapper(), LoadOptions.defaults());
    }

    public JsonGraphCodec(ObjectMapper mapper, LoadOptions loadOptions) {
        this.mapper = mapper;
        this.loadOptions = loadOptions;
    }

    // ── Definition <-> graph ─────────────────────────────────────

    public GraphDefinition toDefinition(AbstractGraph graph) {
        GraphDefinition def = new GraphDefinition();
        def.setType(graph.orientation().name());

        List<GraphDefinition.NodeDef> nodeDefs = new ArrayList<>(graph.size());
        graph.nodes().forEach((node, attributes) -> {
            GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
            nd.setIdentifier(node.value());
            nd.setAttributes(new LinkedHashMap<>(attributes));
            nodeDefs.add(nd);
        });
        def.setNodes(nodeDefs);

        List<GraphDefinition.CoupleDef> coupleDefs = new ArrayList<>(graph.edges().size());
        graph.edges().forEach((couple, multiples) -> {
            GraphDefinition.CoupleDef cd = new GraphDefinition.CoupleDef();
            cd.setCouple(new ArrayList<>(couple.toList()));
            List<GraphDefinition.EdgeDef> edgeDefs = new ArrayList<>(multiples.size());
            multiples.forEach((edge, attributes) -> {
                GraphDefinition.EdgeDef ed = new GraphDefinition.EdgeDef();
                ed.setIdentifier(edge.value());
                ed.setAttributes(new LinkedHashMap<>(attributes));
                edgeDefs.add(ed);
            });
            cd.setMultiples(edgeDefs);
            coupleDefs.add(cd);
        });
        def.setEdges(coupleDefs);
        return def;
    }

    /**
     * Builds a graph from a definition.
     *
     * Every couple entry and every edge of it becomes a separate bulk-input
     * entry, so a repeated edge identifier reaches the pipeline and fails with
     * DUPLICATION_IN_EDGE_IDENTIFIERS carrying the couple and the
     * EDGE_ALREADY_EXISTS cause. A repeated node identifier is reported only
     * once the whole document has passed validation.
     *
     * @throws IllegalArgumentException if the type is missing or unknown
     * @throws GraphException           if nodes or edges are malformed or
     *                                  repeat an identifier
     */
    public AbstractGraph fromDefinition(GraphDefinition def) {
        if (def.getType() == null)
            throw new IllegalArgumentException("Missing 'type' key");
        Orientation orientation = Orientation.fromString(def.getType());

        Map<Object, Object> nodes = new LinkedHashMap<>();
        Set<Identifier> seen = new HashSet<>();
        Identifier repeated = null;
        if (def.getNodes() != null) {
            for (GraphDefinition.NodeDef nd : def.getNodes()) {
                Object raw = nd.getIdentifier();
                if (Identifier.isAdmissible(raw) && !seen.add(Identifier.from(raw)) && repeated == null)
                    repeated = Identifier.from(raw);
                nodes.put(raw, orEmpty(nd.getAttributes()));
            }
        }

        // array keys compare by identity, so repeated couples stay separate entries
        Map<Object, Object> edges = new LinkedHashMap<>();
        if (def.getEdges() != null) {
            for (GraphDefinition.CoupleDef cd : def.getEdges()) {
                if (cd.getMultiples() == null || cd.getMultiples().isEmpty()) {
                    edges.put(coupleKey(cd), cd.getMultiples() == null ? null : new LinkedHashMap<>());
                    continue;
                }
                for (GraphDefinition.EdgeDef ed : cd.getMultiples()) {
                    Map<Object, Object> single = new LinkedHashMap<>();
                    single.put(ed.getIdentifier(), orEmpty(ed.getAttributes()));
                    edges.put(coupleKey(cd), single);
                }
            }
        }

        AbstractGraph graph = Graphs.create(orientation, nodes, edges, loadOptions);
        if (repeated != null)
            throw GraphException.of(ErrorKind.NODE_ALREADY_EXISTS, repeated);
        return graph;
    }

    // ── String ───────────────────────────────────────────────────

    public String exportToJson(AbstractGraph graph) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDefinition(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + graph, e);
        }
    }

    public AbstractGraph importFromJson(String json) {
        try {
            return fromDefinition(mapper.readValue(json, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse graph snapshot", e);
        }
    }

    // ── Files ────────────────────────────────────────────────────

    /**
     * @throws GraphException WRONG_FILE_EXTENSION unless the file name ends
     *                        with .json
     */
    public void exportToFile(AbstractGraph graph, Path path) {
        requireJsonExtension(path);
        try {
            Files.writeString(path, exportToJson(graph));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph snapshot to " + path, e);
        }
        log.info("Graph snapshot saved to {}", path);
    }

    /**
     * @throws GraphException WRONG_FILE_EXTENSION unless the file name ends
     *                        with .json
     */
    public AbstractGraph importFromFile(Path path) {
        requireJsonExtension(path);
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph snapshot from " + path, e);
        }
        AbstractGraph graph = importFromJson(json);
        log.info("Graph snapshot loaded from {}: {}", path, graph);
        return graph;
    }

    private static void requireJsonExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null || !fileName.toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION))
            throw GraphException.withDetail(ErrorKind.WRONG_FILE_EXTENSION, String.valueOf(path));
    }

    private static Object coupleKey(GraphDefinition.CoupleDef cd) {
        return cd.getCouple() == null ? null : cd.getCouple().toArray();
    }

    private static Map<String, Object> orEmpty(Map<String, Object> attributes) {
        return attributes != null ? attributes : new LinkedHashMap<>();
    }
}
