package io.github.eutro.decompir.core.build;

import io.github.eutro.decompir.core.ast.VarInfo;
import io.github.eutro.decompir.core.types.CType;
import io.github.eutro.decompir.core.types.TypeLattice;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The variables of a function, by name.
 * <p>
 * A name is resolved to the same variable every time. Types supplied on later lookups refine the
 * stored type according to the {@link TypeLattice}, and never overwrite a more precise one.
 */
public final class SymbolTable {
    private final TypeLattice lattice;
    private final IdAllocator ids;
    private final Map<String, VarInfo> symbols = new LinkedHashMap<>();

    public SymbolTable(TypeLattice lattice, IdAllocator ids) {
        this.lattice = lattice;
        this.ids = ids;
    }

    /**
     * Resolve a name, creating the variable if it does not exist yet.
     * <p>
     * The other arguments are only used when creating, except for the type: when given, it replaces
     * the stored type if there is none, or if it is strictly more precise.
     *
     * @param name          The name.
     * @param type          The type, if known.
     * @param altname       The display name, if any.
     * @param parameter     The parameter index, if the variable is a formal.
     * @param globalAddress The address, if the variable is a global.
     * @return The variable.
     */
    public VarInfo getOrCreateSymbol(
            String name,
            @Nullable CType type,
            @Nullable String altname,
            @Nullable Integer parameter,
            @Nullable Long globalAddress
    ) {
        VarInfo existing = symbols.get(name);
        if (existing == null) {
            VarInfo created = new VarInfo(ids.newId(), name, type, altname, parameter, globalAddress);
            symbols.put(name, created);
            return created;
        }
        if (type != null && refines(type, existing.type)) {
            VarInfo refined = existing.withType(type);
            symbols.put(name, refined);
            return refined;
        }
        return existing;
    }

    public VarInfo getOrCreateSymbol(String name) {
        return getOrCreateSymbol(name, null, null, null, null);
    }

    /**
     * Register an already built variable, such as a formal, under its name.
     *
     * @param varInfo The variable.
     * @return The variable.
     * @throws IllegalArgumentException If the name is already taken.
     */
    public <V extends VarInfo> V define(V varInfo) {
        if (symbols.containsKey(varInfo.name)) {
            throw new IllegalArgumentException("symbol " + varInfo.name + " is already defined");
        }
        symbols.put(varInfo.name, varInfo);
        return varInfo;
    }

    private boolean refines(CType candidate, @Nullable CType current) {
        if (current == null) return true;
        // strictly more precise only, so equal and incomparable types keep the current one
        return lattice.isLeq(candidate, current) && !lattice.isLeq(current, candidate);
    }

    public boolean hasSymbol(String name) {
        return symbols.containsKey(name);
    }

    /**
     * Get an existing variable.
     *
     * @param name The name.
     * @return The variable.
     * @throws NoSuchElementException If there is no such variable.
     */
    public VarInfo getSymbol(String name) {
        VarInfo varInfo = symbols.get(name);
        if (varInfo == null) throw new NoSuchElementException("symbol " + name + " not found");
        return varInfo;
    }

    public Collection<VarInfo> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }
}
