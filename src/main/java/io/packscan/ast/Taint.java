package io.packscan.ast;

/**
 * Provenance classification attached to every tree node.
 * <p>
 * The values form a lattice ordered {@code SAFE < UNKNOWN < TAINTED}; {@link #combine(Taint)}
 * is the join, so it is associative and commutative and {@code TAINTED} absorbs everything.
 */
public enum Taint {
    /**
     * Value is constant or otherwise independent of untrusted input.
     */
    SAFE,

    /**
     * Nothing is known about the value's provenance. Default for new nodes.
     */
    UNKNOWN,

    /**
     * Value may be controlled by untrusted input.
     */
    TAINTED;

    /**
     * Combines two classifications.
     */
    public Taint combine(Taint other) {
        if (this == TAINTED || other == TAINTED) {
            return TAINTED;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return SAFE;
    }

    /**
     * Combines any number of classifications. An empty input is {@code SAFE}.
     */
    public static Taint combineAll(Iterable<Taint> taints) {
        Taint result = SAFE;
        for (Taint taint : taints) {
            result = result.combine(taint);
        }
        return result;
    }
}
