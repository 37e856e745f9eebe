package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The address of an lvalue. The lvalue is not read, but its variable becomes address-taken.
 */
public final class AddressOf extends Expr {
    public final Lval lval;

    public AddressOf(int id, Lval lval) {
        super(id);
        this.lval = lval;
    }

    @Override
    public String getTag() {
        return "address-of";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.singletonList(lval);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAddressOf(this);
    }

    @Override
    public Set<String> use() {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>();
        result.add(lval.toString());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>();
        result.add(lval.toString());
        return result;
    }

    @Override
    public String toCLike() {
        return "&" + lval.toCLike();
    }

    @Override
    public String toString() {
        return "&(" + lval + ")";
    }
}
