package io.github.eutro.decompir.core.ast;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Access to an array element.
 */
public final class IndexOffset extends Offset {
    public final Expr index;
    public final Offset sub;

    public IndexOffset(int id, Expr index, Offset sub) {
        super(id);
        this.index = index;
        this.sub = sub;
    }

    @Override
    public String getTag() {
        return "index-offset";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(index, sub);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIndexOffset(this);
    }

    @Override
    public Set<String> use() {
        Set<String> result = new LinkedHashSet<>(index.use());
        result.addAll(sub.use());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(index.addressTaken());
        result.addAll(sub.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>(index.variablesUsed());
        result.addAll(sub.variablesUsed());
        return result;
    }

    @Override
    public String toCLike(int indent) {
        return "[" + index.toCLike() + "]" + sub.toCLike();
    }

    @Override
    public String toString() {
        return "[" + index + "]" + sub;
    }
}
