package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A read of an lvalue.
 */
public class LvalExpr extends Expr {
    public final Lval lval;

    public LvalExpr(int id, Lval lval) {
        super(id);
        this.lval = lval;
    }

    @Override
    public String getTag() {
        return "lval-expr";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.singletonList(lval);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLvalExpr(this);
    }

    @Override
    public Set<String> use() {
        return lval.use();
    }

    @Override
    public Set<String> addressTaken() {
        return lval.addressTaken();
    }

    @Override
    public Set<String> variablesUsed() {
        return lval.variablesUsed();
    }

    @Override
    public String toCLike() {
        return lval.toCLike();
    }

    @Override
    public String toString() {
        return lval.toString();
    }
}
