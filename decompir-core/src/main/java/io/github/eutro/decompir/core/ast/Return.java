package io.github.eutro.decompir.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A return statement, with or without a value.
 */
public final class Return extends Stmt {
    @Nullable
    private final Expr expr;

    public Return(int id, @Nullable Expr expr) {
        super(id);
        this.expr = expr;
    }

    /**
     * Whether this returns a value.
     *
     * @return Whether there is a return value.
     */
    public boolean hasReturnValue() {
        return expr != null;
    }

    /**
     * Get the returned expression. Check {@link #hasReturnValue()} first.
     *
     * @return The returned expression.
     * @throws IllegalStateException If there is no return value.
     */
    public Expr getExpr() {
        if (expr == null) {
            throw new IllegalStateException("return " + id + " has no return value");
        }
        return expr;
    }

    @Override
    public String getTag() {
        return "return";
    }

    @Override
    public List<? extends Node> children() {
        return expr == null ? Collections.emptyList() : Collections.singletonList(expr);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public Set<String> addressTaken() {
        return expr == null ? new LinkedHashSet<>() : expr.addressTaken();
    }

    @Override
    public Set<String> variablesUsed() {
        return expr == null ? new LinkedHashSet<>() : expr.variablesUsed();
    }

    @Override
    public Set<String> callees() {
        return new LinkedHashSet<>();
    }

    @Override
    public String toCLike(int indent) {
        if (expr == null) return spaces(indent) + "return;";
        return spaces(indent) + "return " + expr.toCLike() + ";";
    }
}
