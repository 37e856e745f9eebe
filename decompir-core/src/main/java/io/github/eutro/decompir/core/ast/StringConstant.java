package io.github.eutro.decompir.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A string literal, found at a known address in the binary.
 */
public final class StringConstant extends Constant {
    /**
     * The expression that computed the string's address, if known.
     */
    @Nullable
    public final Expr source;
    public final String text;
    public final String address;

    public StringConstant(int id, @Nullable Expr source, String text, String address) {
        super(id);
        this.source = source;
        this.text = text;
        this.address = address;
    }

    @Override
    public String getTag() {
        return "string-constant";
    }

    @Override
    public List<? extends Node> children() {
        return source == null ? Collections.emptyList() : Collections.singletonList(source);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStringConstant(this);
    }

    @Override
    public Set<String> variablesUsed() {
        return new LinkedHashSet<>();
    }

    @Override
    public String toCLike() {
        return '"' + text + '"';
    }

    @Override
    public String toString() {
        return '"' + text + '"';
    }
}
