package io.github.eutro.decompir.core.ast;

import java.util.Set;

/**
 * An offset into an lvalue: {@link NoOffset}, {@link FieldOffset} or {@link IndexOffset}.
 * Field and index offsets chain to a further sub-offset.
 */
public abstract class Offset extends Node {
    Offset(int id) {
        super(id);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public abstract Set<String> use();

    public abstract Set<String> addressTaken();

    public abstract Set<String> variablesUsed();

    /**
     * A visitor over the variants of {@link Offset}.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitNoOffset(NoOffset offset);

        R visitFieldOffset(FieldOffset offset);

        R visitIndexOffset(IndexOffset offset);
    }
}
