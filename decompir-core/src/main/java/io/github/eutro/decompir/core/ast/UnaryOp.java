package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.List;
import java.util.Set;

public final class UnaryOp extends Expr {
    public final String op;
    public final Expr expr;

    /**
     * Construct a unary operation.
     *
     * @param id   The id.
     * @param op   The operator, one of {@link Operators#UNARY}.
     * @param expr The operand.
     * @throws IllegalArgumentException If the operator is unknown.
     */
    public UnaryOp(int id, String op, Expr expr) {
        super(id);
        Operators.unaryText(op);
        this.op = op;
        this.expr = expr;
    }

    @Override
    public String getTag() {
        return "unary-op";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.singletonList(expr);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnaryOp(this);
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
        return Operators.unaryText(op) + Operators.parenthesize(expr);
    }

    @Override
    public String toString() {
        return "(" + Operators.unaryText(op) + expr + ")";
    }
}
