package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.flow.LiveVars;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A call, whose result is either assigned to an lvalue or discarded.
 */
public final class Call extends Instr {
    public final Expr target;
    public final List<Expr> args;

    public Call(int id, Lval lhs, Expr target, List<? extends Expr> args) {
        super(id, lhs);
        this.target = target;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Whether the result of this call is discarded.
     *
     * @return Whether the lhs is the ignored placeholder.
     */
    public boolean isResultIgnored() {
        return lhs.isIgnored();
    }

    @Override
    public String getTag() {
        return "call";
    }

    @Override
    public List<? extends Node> children() {
        List<Node> children = new ArrayList<>(args.size() + 2);
        children.add(lhs);
        children.add(target);
        children.addAll(args);
        return children;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public Set<String> use() {
        Set<String> result = new LinkedHashSet<>(target.use());
        for (Expr arg : args) result.addAll(arg.use());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(target.addressTaken());
        for (Expr arg : args) result.addAll(arg.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>();
        if (!isResultIgnored()) result.addAll(lhs.variablesUsed());
        result.addAll(target.variablesUsed());
        for (Expr arg : args) result.addAll(arg.variablesUsed());
        return result;
    }

    @Override
    public Set<String> callees() {
        Set<String> result = new LinkedHashSet<>();
        result.add(target.toString());
        return result;
    }

    @Override
    public boolean isLive(Optional<LiveVars> liveness) {
        return true;
    }

    @Override
    public String toCLike(int indent) {
        StringBuilder sb = new StringBuilder(spaces(indent));
        if (!isResultIgnored()) sb.append(lhs.toCLike()).append(" = ");
        sb.append(target.toCLike()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i).toCLike());
        }
        return sb.append(");").toString();
    }
}
