package com.connections.api;

import java.util.UUID;

/**
 * Opaque key of a node or an edge.
 *
 * An identifier wraps either a string or an integral number. Integral values
 * of any width (Byte, Short, Integer, Long) are normalized to a long, so
 * {@code Identifier.from(1)} and {@code Identifier.from(1L)} are equal.
 *
 * Identifiers are totally ordered: numbers sort before strings, numbers by
 * value and strings lexicographically. The undirected graph relies on this
 * order to canonicalize an endpoint pair.
 */
public final class Identifier implements Comparable<Identifier> {
    private final Object value;

    private Identifier(Object value) {
        this.value = value;
    }

    public static Identifier of(String value) {
        if (value == null)
            throw new IllegalArgumentException("Identifier value must not be null");
        return new Identifier(value);
    }

    public static Identifier of(long value) {
        return new Identifier(value);
    }

    /**
     * Generates a fresh identifier from a random (version 4) UUID: 122 random
     * bits, rendered as 32 lowercase hex characters without dashes.
     */
    public static Identifier generate() {
        return new Identifier(UUID.randomUUID().toString().replace("-", ""));
    }

    /**
     * Returns true if {@code raw} can be turned into an identifier by
     * {@link #from(Object)}.
     */
    public static boolean isAdmissible(Object raw) {
        return raw instanceof Identifier
                || raw instanceof String
                || raw instanceof Long
                || raw instanceof Integer
                || raw instanceof Short
                || raw instanceof Byte;
    }

    /**
     * Converts a loosely typed value (as found in bulk input or a parsed JSON
     * document) into an identifier.
     *
     * @throws IllegalArgumentException if the value is not admissible.
     */
    public static Identifier from(Object raw) {
        if (raw instanceof Identifier id)
            return id;
        if (raw instanceof String s)
            return new Identifier(s);
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte)
            return new Identifier(((Number) raw).longValue());
        throw new IllegalArgumentException("Not an identifier: " + raw);
    }

    /** The wrapped value: a {@link String} or a {@link Long}. */
    public Object value() {
        return value;
    }

    public boolean isNumeric() {
        return value instanceof Long;
    }

    @Override
    public int compareTo(Identifier other) {
        if (isNumeric() != other.isNumeric())
            return isNumeric() ? -1 : 1;
        if (isNumeric())
            return Long.compare((Long) value, (Long) other.value);
        return ((String) value).compareTo((String) other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Identifier other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
