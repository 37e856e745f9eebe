package io.github.eutro.decompir.core.ast;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A location: a {@link LHost host} followed by a chain of {@link Offset offsets}.
 */
public final class Lval extends Node {
    /**
     * The lvalue of a call whose result is discarded.
     */
    public static final Lval IGNORED = new Lval(NO_ID, new Variable(NO_ID, VarInfo.IGNORED), NoOffset.INSTANCE);

    public final LHost host;
    public final Offset offset;

    public Lval(int id, LHost host, Offset offset) {
        super(id);
        this.host = host;
        this.offset = offset;
    }

    public boolean isIgnored() {
        return id == NO_ID;
    }

    public boolean isVariable() {
        return host instanceof Variable;
    }

    public boolean isMemRef() {
        return host instanceof MemRef;
    }

    public boolean isGlobal() {
        return host instanceof Variable && host.asVariable().varInfo.isGlobal();
    }

    /**
     * Whether this lvalue denotes only part of its host, like {@code s.f} or {@code a[i]}.
     *
     * @return Whether there is a field or index offset.
     */
    public boolean hasOffset() {
        return !(offset instanceof NoOffset);
    }

    /**
     * Get the name of the variable this lvalue writes into, whole or in part.
     *
     * @return The name of the host variable.
     * @throws IllegalStateException If the host is a memory reference.
     */
    public String getRootName() {
        if (!isVariable()) throw new IllegalStateException("lvalue " + this + " has no root variable");
        return host.asVariable().getName();
    }

    /**
     * Whether the variable at the root of this lvalue has a user-supplied display name.
     *
     * @return Whether there is an alternate name.
     */
    public boolean hasAltname() {
        return host instanceof Variable && host.asVariable().varInfo.hasAltname();
    }

    /**
     * Get the names read when this lvalue is read.
     *
     * @return The names.
     */
    public Set<String> use() {
        Set<String> result = new LinkedHashSet<>(host.use());
        result.addAll(offset.use());
        return result;
    }

    /**
     * Get the names read to compute the address this lvalue denotes, which
     * are read even when the lvalue is only written.
     *
     * @return The names.
     */
    public Set<String> addressUse() {
        Set<String> result = new LinkedHashSet<>(host.addressUse());
        result.addAll(offset.use());
        return result;
    }

    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(host.addressTaken());
        result.addAll(offset.addressTaken());
        return result;
    }

    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>(host.variablesUsed());
        result.addAll(offset.variablesUsed());
        return result;
    }

    @Override
    public String getTag() {
        return "lval";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(host, offset);
    }

    @Override
    public String toCLike(int indent) {
        return host.toCLike() + offset.toCLike();
    }

    /**
     * Get the canonical name of this lvalue, as used by the dataflow analyses.
     *
     * @return The name.
     */
    @Override
    public String toString() {
        return host.toString() + offset.toString();
    }
}
