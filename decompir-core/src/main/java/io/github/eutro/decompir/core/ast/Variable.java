package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named variable as an lvalue host.
 */
public final class Variable extends LHost {
    /**
     * The name of the program counter, which is never considered read.
     */
    public static final String PROGRAM_COUNTER = "PC";

    public final VarInfo varInfo;

    public Variable(int id, VarInfo varInfo) {
        super(id);
        this.varInfo = varInfo;
    }

    public String getName() {
        return varInfo.name;
    }

    @Override
    public String getTag() {
        return "var";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public Set<String> use() {
        Set<String> result = new LinkedHashSet<>();
        if (!PROGRAM_COUNTER.equals(getName())) result.add(getName());
        return result;
    }

    @Override
    public Set<String> addressUse() {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> addressTaken() {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>();
        result.add(getName());
        return result;
    }

    @Override
    public String toCLike(int indent) {
        return varInfo.getDisplayName();
    }

    @Override
    public String toString() {
        return getName();
    }
}
