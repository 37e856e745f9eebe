package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.types.CType;
import org.jetbrains.annotations.Nullable;

/**
 * A named storage location: a register, stack slot, global or formal parameter.
 * <p>
 * Variable infos are symbols rather than tree nodes; they are shared by reference between
 * all {@link Variable}s that refer to the same name in a function.
 */
public class VarInfo {
    /**
     * The variable of the ignored lvalue.
     */
    public static final VarInfo IGNORED = new VarInfo(Node.NO_ID, "ignored", null, null, null, null);

    public final int id;
    public final String name;
    @Nullable
    public final CType type;
    /**
     * A display name supplied by the user, which overrides {@link #name} in output.
     */
    @Nullable
    public final String altname;
    /**
     * The source-level index of this variable, if it is a formal parameter.
     */
    @Nullable
    public final Integer parameter;
    @Nullable
    public final Long globalAddress;

    public VarInfo(
            int id,
            String name,
            @Nullable CType type,
            @Nullable String altname,
            @Nullable Integer parameter,
            @Nullable Long globalAddress
    ) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.altname = altname;
        this.parameter = parameter;
        this.globalAddress = globalAddress;
    }

    public boolean hasAltname() {
        return altname != null;
    }

    public boolean isGlobal() {
        return globalAddress != null;
    }

    public boolean isParameter() {
        return parameter != null;
    }

    public String getDisplayName() {
        return altname == null ? name : altname;
    }

    /**
     * Get a copy of this variable with a different type.
     *
     * @param newType The new type.
     * @return The copy, with the same id.
     */
    public VarInfo withType(@Nullable CType newType) {
        return new VarInfo(id, name, newType, altname, parameter, globalAddress);
    }

    /**
     * Render this variable as a C declaration.
     *
     * @return The declaration text.
     */
    public String toCLike() {
        return (type == null ? "?" : type.toCLike()) + " " + getDisplayName();
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
