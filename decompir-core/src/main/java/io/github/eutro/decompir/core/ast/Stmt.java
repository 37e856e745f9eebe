package io.github.eutro.decompir.core.ast;

import java.util.Set;

/**
 * A statement: one of {@link Return}, {@link Block}, {@link InstrSequence} or {@link Branch}.
 */
public abstract class Stmt extends Node {
    /**
     * The number of spaces each nesting level is indented by in C-like output.
     */
    public static final int C_INDENT = 3;

    Stmt(int id) {
        super(id);
    }

    /**
     * Dispatch on the variant of this statement.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor method for this variant.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Whether this statement contains no instructions or returns.
     *
     * @return Whether the statement is empty.
     */
    public abstract boolean isEmpty();

    /**
     * Get the names of variables whose address is taken anywhere in this statement.
     *
     * @return The names.
     */
    public abstract Set<String> addressTaken();

    /**
     * Get the names of all variables referenced in this statement.
     *
     * @return The names.
     */
    public abstract Set<String> variablesUsed();

    /**
     * Get the textual targets of all calls in this statement.
     *
     * @return The call targets.
     */
    public abstract Set<String> callees();

    @Override
    public String toString() {
        return toCLike(0);
    }

    /**
     * A visitor over the variants of {@link Stmt}.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitReturn(Return stmt);

        R visitBlock(Block stmt);

        R visitInstrSequence(InstrSequence stmt);

        R visitBranch(Branch stmt);
    }
}
