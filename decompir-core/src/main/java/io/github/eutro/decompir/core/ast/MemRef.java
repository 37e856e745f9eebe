package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A dereference of an address expression as an lvalue host.
 */
public final class MemRef extends LHost {
    public final Expr address;

    public MemRef(int id, Expr address) {
        super(id);
        this.address = address;
    }

    @Override
    public String getTag() {
        return "memref";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.singletonList(address);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMemRef(this);
    }

    @Override
    public Set<String> use() {
        return address.use();
    }

    @Override
    public Set<String> addressUse() {
        return address.use();
    }

    @Override
    public Set<String> addressTaken() {
        return address.addressTaken();
    }

    @Override
    public Set<String> variablesUsed() {
        return address.variablesUsed();
    }

    @Override
    public String toCLike(int indent) {
        return "*(" + address.toCLike() + ")";
    }

    @Override
    public String toString() {
        return "*(" + address + ")";
    }
}
