package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.types.CType;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Access to a named field of a struct.
 */
public final class FieldOffset extends Offset {
    public final String fieldName;
    /**
     * The type of the field, if known.
     */
    @Nullable
    public final CType fieldType;
    public final Offset sub;

    public FieldOffset(int id, String fieldName, @Nullable CType fieldType, Offset sub) {
        super(id);
        this.fieldName = fieldName;
        this.fieldType = fieldType;
        this.sub = sub;
    }

    @Override
    public String getTag() {
        return "field-offset";
    }

    @Override
    public List<? extends Node> children() {
        return Collections.singletonList(sub);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFieldOffset(this);
    }

    @Override
    public Set<String> use() {
        return sub.use();
    }

    @Override
    public Set<String> addressTaken() {
        return sub.addressTaken();
    }

    @Override
    public Set<String> variablesUsed() {
        return sub.variablesUsed();
    }

    @Override
    public String toCLike(int indent) {
        return "." + fieldName + sub.toCLike();
    }

    @Override
    public String toString() {
        return "." + fieldName + sub;
    }
}
