package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.flow.LiveVars;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An assignment of an expression to an lvalue.
 */
public final class Assign extends Instr {
    /**
     * Prefix of the synthetic variables that hold call return values.
     */
    public static final String RETURN_TEMP_PREFIX = "rtn_";

    public final Expr rhs;

    public Assign(int id, Lval lhs, Expr rhs) {
        super(id, lhs);
        this.rhs = rhs;
    }

    @Override
    public String getTag() {
        return "assign";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(lhs, rhs);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public Set<String> use() {
        return rhs.use();
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(lhs.addressTaken());
        result.addAll(rhs.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>(lhs.variablesUsed());
        result.addAll(rhs.variablesUsed());
        return result;
    }

    @Override
    public Set<String> callees() {
        return new LinkedHashSet<>();
    }

    /**
     * Whether this assignment writes a value back to where it was read from, like {@code x = x}.
     *
     * @return Whether both sides render identically.
     */
    public boolean isNoOp() {
        return lhs.toCLike().equals(rhs.toCLike());
    }

    @Override
    public boolean isLive(Optional<LiveVars> liveness) {
        if (isNoOp()) return false;
        if (lhs.isMemRef()
                || lhs.isGlobal()
                || lhs.hasAltname()
                || define().startsWith(RETURN_TEMP_PREFIX)) {
            return true;
        }
        if (!liveness.isPresent() || !liveness.get().has(id)) return true;
        return liveness.get().get(id).contains(lhs.getRootName());
    }

    @Override
    public String toCLike(int indent) {
        return spaces(indent) + lhs.toCLike() + " = " + rhs.toCLike() + ";";
    }
}
