package io.github.eutro.decompir.core.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * A read of an lvalue whose single reaching definition is known.
 * <p>
 * The defining instruction is referred to by id. The substituted expression is the
 * right-hand side of that definition, and may be shared with it.
 */
public final class SubstitutedExpr extends LvalExpr {
    /**
     * The id of the instruction that assigned {@link #lval}.
     */
    public final int assignId;
    public final Expr substituted;

    public SubstitutedExpr(int id, Lval lval, int assignId, Expr substituted) {
        super(id, lval);
        this.assignId = assignId;
        this.substituted = substituted;
    }

    @Override
    public String getTag() {
        return "substituted-expr";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(lval, substituted);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSubstitutedExpr(this);
    }

    @Override
    public Set<String> use() {
        return substituted.use();
    }

    @Override
    public Set<String> addressTaken() {
        return substituted.addressTaken();
    }

    @Override
    public Set<String> variablesUsed() {
        return substituted.variablesUsed();
    }

    @Override
    public String toCLike() {
        return substituted.toCLike();
    }
}
