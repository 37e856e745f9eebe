package io.github.eutro.decompir.core.ast;

import java.util.Set;

/**
 * The host of an {@link Lval}: a {@link Variable} or a {@link MemRef}.
 */
public abstract class LHost extends Node {
    LHost(int id) {
        super(id);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public abstract Set<String> use();

    public abstract Set<String> addressUse();

    public abstract Set<String> addressTaken();

    public abstract Set<String> variablesUsed();

    Variable asVariable() {
        return (Variable) this;
    }

    /**
     * A visitor over the variants of {@link LHost}.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitVariable(Variable host);

        R visitMemRef(MemRef host);
    }
}
