package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.List;
import java.util.Set;

public final class CastExpr extends Expr {
    /**
     * The target type, as C text.
     */
    public final String targetType;
    public final Expr expr;

    public CastExpr(int id, String targetType, Expr expr) {
        super(id);
        this.targetType = targetType;
        this.expr = expr;
    }

    @Override
    public String getTag() {
        return "cast-expr";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.singletonList(expr);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCastExpr(this);
    }

    @Override
    public Set<String> use() {
        return expr.use();
    }

    @Override
    public Set<String> addressTaken() {
        return expr.addressTaken();
    }

    @Override
    public Set<String> variablesUsed() {
        return expr.variablesUsed();
    }

    @Override
    public String toCLike() {
        return "(" + targetType + ")" + Operators.parenthesize(expr);
    }

    @Override
    public String toString() {
        return "((" + targetType + ")" + expr + ")";
    }
}
