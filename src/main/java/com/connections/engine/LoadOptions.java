package com.connections.engine;

/**
 * Settings of the bulk-load pipeline used by graph constructors.
 */
public final class LoadOptions {

    /** What an empty edge-identifier mapping in bulk edge input means. */
    public enum EmptyMultiples {
        /** Insert one edge with a generated identifier and no attributes. */
        AUTO_EDGE,
        /** Fail with WRONG_LENGTH_OF_MULTIPLE_EDGES. */
        REJECT
    }

    private static final LoadOptions DEFAULTS = builder().build();

    private final EmptyMultiples emptyMultiples;
    private final boolean recalculate;

    private LoadOptions(EmptyMultiples emptyMultiples, boolean recalculate) {
        this.emptyMultiples = emptyMultiples;
        this.recalculate = recalculate;
    }

    /** AUTO_EDGE, recalculate after loading. */
    public static LoadOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public EmptyMultiples emptyMultiples() {
        return emptyMultiples;
    }

    /** Whether construction ends with a degree/neighbor pass. */
    public boolean recalculate() {
        return recalculate;
    }

    public static final class Builder {
        private EmptyMultiples emptyMultiples = EmptyMultiples.AUTO_EDGE;
        private boolean recalculate = true;

        public Builder emptyMultiples(EmptyMultiples emptyMultiples) {
            if (emptyMultiples == null)
                throw new IllegalArgumentException("emptyMultiples must not be null");
            this.emptyMultiples = emptyMultiples;
            return this;
        }

        public Builder recalculate(boolean recalculate) {
            this.recalculate = recalculate;
            return this;
        }

        public LoadOptions build() {
            return new LoadOptions(emptyMultiples, recalculate);
        }
    }
}
