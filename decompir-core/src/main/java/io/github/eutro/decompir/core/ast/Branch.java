package io.github.eutro.decompir.core.ast;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A two-way conditional statement.
 */
public final class Branch extends Stmt {
    public final Expr cond;
    public final Stmt thenStmt;
    public final Stmt elseStmt;
    /**
     * The signed offset of the branch target relative to the branch instruction,
     * kept for mapping the statement back to its span in the binary.
     */
    public final int relativeOffset;

    public Branch(int id, Expr cond, Stmt thenStmt, Stmt elseStmt, int relativeOffset) {
        super(id);
        this.cond = cond;
        this.thenStmt = thenStmt;
        this.elseStmt = elseStmt;
        this.relativeOffset = relativeOffset;
    }

    @Override
    public String getTag() {
        return "if";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(cond, thenStmt, elseStmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBranch(this);
    }

    @Override
    public boolean isEmpty() {
        return thenStmt.isEmpty() && elseStmt.isEmpty();
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(cond.addressTaken());
        result.addAll(thenStmt.addressTaken());
        result.addAll(elseStmt.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>(cond.variablesUsed());
        result.addAll(thenStmt.variablesUsed());
        result.addAll(elseStmt.variablesUsed());
        return result;
    }

    @Override
    public Set<String> callees() {
        Set<String> result = new LinkedHashSet<>(thenStmt.callees());
        result.addAll(elseStmt.callees());
        return result;
    }

    @Override
    public String toCLike(int indent) {
        String pad = spaces(indent);
        StringBuilder sb = new StringBuilder();
        sb.append(pad).append("if (").append(cond.toCLike()).append("){");
        String thenText = thenStmt.toCLike(indent + C_INDENT);
        if (!thenText.isEmpty()) sb.append('\n').append(thenText);
        if (!elseStmt.isEmpty()) {
            sb.append('\n').append(pad).append("} else {");
            sb.append('\n').append(elseStmt.toCLike(indent + C_INDENT));
        }
        sb.append('\n').append(pad).append('}');
        return sb.toString();
    }
}
