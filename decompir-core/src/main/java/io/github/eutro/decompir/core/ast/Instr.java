package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.flow.LiveVars;

import java.util.Optional;
import java.util.Set;

/**
 * An instruction: either an {@link Assign} or a {@link Call}.
 */
public abstract class Instr extends Node {
    /**
     * The lvalue written by this instruction. For a call whose result is discarded
     * this is {@link Lval#IGNORED}.
     */
    public final Lval lhs;

    Instr(int id, Lval lhs) {
        super(id);
        this.lhs = lhs;
    }

    /**
     * Dispatch on the variant of this instruction.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor method for this variant.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get the name defined by this instruction.
     *
     * @return The canonical text of the written lvalue.
     */
    public String define() {
        return lhs.toString();
    }

    /**
     * Get the names read by this instruction.
     *
     * @return The names.
     */
    public abstract Set<String> use();

    public abstract Set<String> addressTaken();

    public abstract Set<String> variablesUsed();

    public abstract Set<String> callees();

    /**
     * Decide whether this instruction must be kept, given the live variables on exit
     * from each instruction.
     *
     * @param liveness The liveness data, if any was computed.
     * @return False if the instruction is provably dead.
     */
    public abstract boolean isLive(Optional<LiveVars> liveness);

    @Override
    public String toString() {
        return toCLike(0);
    }

    /**
     * A visitor over the variants of {@link Instr}.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitAssign(Assign instr);

        R visitCall(Call instr);
    }
}
