package io.github.eutro.decompir.core.ast;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A conditional expression, {@code c ? t : f}.
 */
public final class Question extends Expr {
    public final Expr cond;
    public final Expr ifTrue;
    public final Expr ifFalse;

    public Question(int id, Expr cond, Expr ifTrue, Expr ifFalse) {
        super(id);
        this.cond = cond;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public String getTag() {
        return "question";
    }

    @Override
    public List<? extends Node> children() {
        return Arrays.asList(cond, ifTrue, ifFalse);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitQuestion(this);
    }

    @Override
    public Set<String> use() {
        Set<String> result = new LinkedHashSet<>(cond.use());
        result.addAll(ifTrue.use());
        result.addAll(ifFalse.use());
        return result;
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>(cond.addressTaken());
        result.addAll(ifTrue.addressTaken());
        result.addAll(ifFalse.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>(cond.variablesUsed());
        result.addAll(ifTrue.variablesUsed());
        result.addAll(ifFalse.variablesUsed());
        return result;
    }

    @Override
    public String toCLike() {
        return "(" + cond.toCLike() + " ? " + ifTrue.toCLike() + " : " + ifFalse.toCLike() + ")";
    }

    @Override
    public String toString() {
        return "(" + cond + " ? " + ifTrue + " : " + ifFalse + ")";
    }
}
