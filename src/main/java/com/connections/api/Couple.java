package com.connections.api;

import java.util.List;

/**
 * Edge store key: the two endpoints of an edge.
 *
 * A couple is always created through an {@code Orientation}, which decides
 * whether the order of the endpoints is significant. Two couples are equal when
 * their left and right endpoints are equal.
 */
public final class Couple {
    private final Identifier left;
    private final Identifier right;

    public Couple(Identifier left, Identifier right) {
        if (left == null || right == null)
            throw new IllegalArgumentException("Couple endpoints must not be null");
        this.left = left;
        this.right = right;
    }

    public Identifier left() {
        return left;
    }

    public Identifier right() {
        return right;
    }

    /** A loop connects a node to itself. */
    public boolean isLoop() {
        return left.equals(right);
    }

    public boolean contains(Identifier node) {
        return left.equals(node) || right.equals(node);
    }

    /** The endpoint opposite to {@code node}, which must be one of the two. */
    public Identifier opposite(Identifier node) {
        if (left.equals(node))
            return right;
        if (right.equals(node))
            return left;
        throw new IllegalArgumentException(node + " is not an endpoint of " + this);
    }

    /** Endpoints as raw values, in the form the JSON snapshot stores them. */
    public List<Object> toList() {
        return List.of(left.value(), right.value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Couple other && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return 31 * left.hashCode() + right.hashCode();
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
