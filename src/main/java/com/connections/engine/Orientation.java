package com.connections.engine;

import com.connections.api.Couple;
import com.connections.api.Identifier;

import java.util.function.BiConsumer;

/**
 * The two points where directed and undirected graphs differ.
 *
 * Everything else (mutation, validation, recomputation, subgraphs, structural
 * predicates) lives once in {@link AbstractGraph}.
 */
public enum Orientation {

    /** Order of the endpoints is the edge direction; neighbors are successors. */
    DIRECTED("Directed Graph") {
        @Override
        public Couple couple(Identifier left, Identifier right) {
            return new Couple(left, right);
        }

        @Override
        public void linkNeighbors(Couple couple, BiConsumer<Identifier, Identifier> link) {
            link.accept(couple.left(), couple.right());
        }
    },

    /** (a, b) and (b, a) share one couple, lower identifier first; neighbors are symmetric. */
    UNDIRECTED("Undirected Graph") {
        @Override
        public Couple couple(Identifier left, Identifier right) {
            return left.compareTo(right) <= 0 ? new Couple(left, right) : new Couple(right, left);
        }

        @Override
        public void linkNeighbors(Couple couple, BiConsumer<Identifier, Identifier> link) {
            link.accept(couple.left(), couple.right());
            link.accept(couple.right(), couple.left());
        }
    };

    private final String typeName;

    Orientation(String typeName) {
        this.typeName = typeName;
    }

    /** Canonical couple for a pair of endpoints. */
    public abstract Couple couple(Identifier left, Identifier right);

    /**
     * Reports every (node, neighbor) relation a couple creates.
     *
     * @param couple a canonical couple
     * @param link   receives (node, neighbor)
     */
    public abstract void linkNeighbors(Couple couple, BiConsumer<Identifier, Identifier> link);

    public String typeName() {
        return typeName;
    }

    public static Orientation fromString(String text) {
        for (Orientation o : values()) {
            if (o.name().equalsIgnoreCase(text)) {
                return o;
            }
        }
        throw new IllegalArgumentException("Unknown Orientation: " + text);
    }
}
