package com.connections.api;

/**
 * Closed set of failure conditions a graph can report.
 *
 * Callers discriminate failures by kind (or by {@link Family}) rather than by
 * message text. Validation kinds are listed in the order the bulk-load pipeline
 * checks them.
 */
public enum ErrorKind {
    // --- Nodes validation ---
    WRONG_TYPE_OF_NODES(Family.NODES_VALIDATION,
            "Wrong type of nodes: nodes must be a Map or a Collection"),
    WRONG_TYPE_OF_NODE_IDENTIFIER(Family.NODES_VALIDATION,
            "Wrong type of node identifier: node identifier must be a String or an integral number"),
    WRONG_TYPE_OF_NODE_ATTRIBUTES(Family.NODES_VALIDATION,
            "Wrong type of node attributes: node attributes must be a Map with String keys"),

    // --- Edges validation ---
    WRONG_TYPE_OF_EDGES(Family.EDGES_VALIDATION,
            "Wrong type of edges: edges must be a Map or a Collection"),
    WRONG_TYPE_OF_COUPLE(Family.EDGES_VALIDATION,
            "Wrong type of couple: couple must be a Couple, a List or an array"),
    WRONG_LENGTH_OF_COUPLE(Family.EDGES_VALIDATION,
            "Wrong length of couple: couple must hold exactly 2 node identifiers"),
    WRONG_TYPE_OF_NODE_IDENTIFIER_IN_COUPLE(Family.EDGES_VALIDATION,
            "Wrong type of node identifier in couple: node identifier must be a String or an integral number"),
    WRONG_TYPE_OF_MULTIPLE_EDGES(Family.EDGES_VALIDATION,
            "Wrong type of multiple edges: multiple edges must be a Map"),
    WRONG_LENGTH_OF_MULTIPLE_EDGES(Family.EDGES_VALIDATION,
            "Wrong length of multiple edges: multiple edges must not be empty"),
    WRONG_TYPE_OF_EDGE_IDENTIFIER(Family.EDGES_VALIDATION,
            "Wrong type of edge identifier: edge identifier must be a String or an integral number"),
    WRONG_TYPE_OF_EDGE_ATTRIBUTES(Family.EDGES_VALIDATION,
            "Wrong type of edge attributes: edge attributes must be a Map with String keys"),
    DUPLICATION_IN_EDGE_IDENTIFIERS(Family.EDGES_VALIDATION,
            "Duplication in edge identifiers"),

    // --- Already exists ---
    NODE_ALREADY_EXISTS(Family.OBJECT_ALREADY_EXISTS, "Node already exists"),
    EDGE_ALREADY_EXISTS(Family.OBJECT_ALREADY_EXISTS, "Edge already exists"),

    // --- Not found ---
    NODE_NOT_FOUND(Family.OBJECT_NOT_FOUND, "Node does not exist"),
    COUPLE_NOT_FOUND(Family.OBJECT_NOT_FOUND, "Couple does not exist"),
    EDGE_NOT_FOUND(Family.OBJECT_NOT_FOUND, "Edge does not exist"),

    // --- Snapshot ---
    WRONG_FILE_EXTENSION(Family.SNAPSHOT, "Wrong file extension: snapshot files must end with .json");

    /** Groups of related kinds. */
    public enum Family {
        NODES_VALIDATION,
        EDGES_VALIDATION,
        OBJECT_ALREADY_EXISTS,
        OBJECT_NOT_FOUND,
        SNAPSHOT;

        public boolean isValidation() {
            return this == NODES_VALIDATION || this == EDGES_VALIDATION;
        }
    }

    private final Family family;
    private final String description;

    ErrorKind(Family family, String description) {
        this.family = family;
        this.description = description;
    }

    public Family family() {
        return family;
    }

    public String description() {
        return description;
    }
}
