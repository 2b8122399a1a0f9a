package com.connections.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * POJO representation of a graph snapshot.
 *
 * Identifiers are kept as raw JSON values (string or number); they are checked
 * by the graph's bulk-load pipeline when the snapshot is imported.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "type", "nodes", "edges" })
public final class GraphDefinition {
    /** Name of an {@code Orientation}, e.g. "DIRECTED". */
    private String type;
    private List<NodeDef> nodes;
    private List<CoupleDef> edges;

    /** A node with its attributes. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "identifier", "attributes" })
    public static final class NodeDef {
        private Object identifier;
        private Map<String, Object> attributes;
    }

    /** A couple with all its parallel edges. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "couple", "multiples" })
    public static final class CoupleDef {
        private List<Object> couple;
        private List<EdgeDef> multiples;
    }

    /** One edge of a couple. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "identifier", "attributes" })
    public static final class EdgeDef {
        private Object identifier;
        private Map<String, Object> attributes;
    }
}
