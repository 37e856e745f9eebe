package io.github.eutro.decompir.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A signed 64-bit integer constant, optionally displayed under a symbolic name.
 */
public final class IntegerConstant extends Constant {
    /**
     * Values above this are displayed in hexadecimal.
     */
    public static final long HEX_THRESHOLD = 100000;

    public final long value;
    /**
     * The symbolic name to display instead of the value, like {@code O_RDONLY}.
     */
    @Nullable
    public final String macroName;

    public IntegerConstant(int id, long value, @Nullable String macroName) {
        super(id);
        this.value = value;
        this.macroName = macroName;
    }

    @Override
    public String getTag() {
        return "integer-constant";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIntegerConstant(this);
    }

    @Override
    public Set<String> variablesUsed() {
        return new LinkedHashSet<>();
    }

    @Override
    public boolean isIntegerConstant() {
        return true;
    }

    @Override
    public long getIntegerValue() {
        return value;
    }

    @Override
    public String toCLike() {
        if (macroName != null) return macroName;
        if (value > HEX_THRESHOLD) return "0x" + Long.toHexString(value);
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
