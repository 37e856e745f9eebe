package io.github.eutro.decompir.core.types;

/**
 * The ordering of an external type system, where smaller types are more precise.
 */
public interface TypeLattice {
    /**
     * A lattice where every type is only comparable with itself.
     */
    TypeLattice FLAT = (a, b) -> a.equals(b);

    /**
     * Check whether {@code a} is at least as precise as {@code b}.
     *
     * @param a The first type.
     * @param b The second type.
     * @return Whether {@code a <= b}.
     */
    boolean isLeq(CType a, CType b);
}
