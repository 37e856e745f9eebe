package io.github.eutro.decompir.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered sequence of statements.
 */
public final class Block extends Stmt {
    /**
     * The statements, in execution order.
     */
    public final List<Stmt> stmts;

    public Block(int id, List<? extends Stmt> stmts) {
        super(id);
        this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
    }

    @Override
    public String getTag() {
        return "block";
    }

    @Override
    public List<? extends Node> children() {
        return stmts;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public boolean isEmpty() {
        for (Stmt stmt : stmts) {
            if (!stmt.isEmpty()) return false;
        }
        return true;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>();
        for (Stmt stmt : stmts) result.addAll(stmt.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>();
        for (Stmt stmt : stmts) result.addAll(stmt.variablesUsed());
        return result;
    }

    @Override
    public Set<String> callees() {
        Set<String> result = new LinkedHashSet<>();
        for (Stmt stmt : stmts) result.addAll(stmt.callees());
        return result;
    }

    @Override
    public String toCLike(int indent) {
        StringBuilder sb = new StringBuilder();
        for (Stmt stmt : stmts) {
            String text = stmt.toCLike(indent);
            if (text.isEmpty()) continue;
            if (sb.length() > 0) sb.append('\n');
            sb.append(text);
        }
        return sb.toString();
    }
}
