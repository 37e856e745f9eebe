package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The end of an offset chain.
 */
public final class NoOffset extends Offset {
    /**
     * The shared placeholder instance.
     */
    public static final NoOffset INSTANCE = new NoOffset(NO_ID);

    public NoOffset(int id) {
        super(id);
    }

    @Override
    public String getTag() {
        return "no-offset";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNoOffset(this);
    }

    @Override
    public Set<String> use() {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> addressTaken() {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> variablesUsed() {
        return new LinkedHashSet<>();
    }

    @Override
    public String toCLike(int indent) {
        return "";
    }

    @Override
    public String toString() {
        return "";
    }
}
