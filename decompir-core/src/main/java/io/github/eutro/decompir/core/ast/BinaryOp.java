package io.github.eutro.decompir.core.ast;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class BinaryOp extends Expr {
    public final String op;
    public final Expr left;
    public final Expr right;

    /**
     * Construct a binary operation.
     *
     * @param id    The id.
     * @param op    The operator, one of {@link Operators#BINARY}.
     * @param left  The left operand.
     * @param right The right operand.
     * @throws IllegalArgumentException If the operator is unknown.
     */
    public BinaryOp(int id, String op, Expr left, Expr right) {
        super(id);
        Operators.binaryText(op);
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public String getTag() {
        return "binary-op";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(left, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public Set<String> use() {
        Set<String> result = new LinkedHashSet<>(left.use());
        result.addAll(right.use());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(left.addressTaken());
        result.addAll(right.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>(left.variablesUsed());
        result.addAll(right.variablesUsed());
        return result;
    }

    @Override
    public String toCLike() {
        return Operators.parenthesize(left) + Operators.binaryText(op) + Operators.parenthesize(right);
    }

    @Override
    public String toString() {
        return "(" + left + Operators.binaryText(op) + right + ")";
    }
}
