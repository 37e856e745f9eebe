package io.github.eutro.decompir.core.flow;

import io.github.eutro.decompir.core.ast.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * The reaching definitions at a program point, as a map from variable name to the single
 * instruction known to have defined it.
 * <p>
 * Instances are immutable; every update returns a new map.
 */
public final class UseDef {
    private static final UseDef EMPTY = new UseDef(Collections.emptyMap());

    private final Map<String, Def> defs;

    private UseDef(Map<String, Def> defs) {
        this.defs = defs;
    }

    public static UseDef empty() {
        return EMPTY;
    }

    /**
     * Create a map with the given definitions.
     *
     * @param defs The definitions, keyed by name.
     * @return The map.
     */
    public static UseDef of(Map<String, Def> defs) {
        return defs.isEmpty() ? EMPTY : new UseDef(Collections.unmodifiableMap(new LinkedHashMap<>(defs)));
    }

    public boolean hasName(String name) {
        return defs.containsKey(name);
    }

    /**
     * Get the definition of a name. Check {@link #hasName(String)} first.
     *
     * @param name The name.
     * @return The definition.
     * @throws NoSuchElementException If the name has no single reaching definition here.
     */
    public Def get(String name) {
        Def def = defs.get(name);
        if (def == null) throw new NoSuchElementException("no definition of " + name + " reaches here");
        return def;
    }

    public Set<String> names() {
        return defs.keySet();
    }

    public int size() {
        return defs.size();
    }

    public boolean isEmpty() {
        return defs.isEmpty();
    }

    public Map<String, Def> asMap() {
        return defs;
    }

    /**
     * Apply an assignment.
     * <p>
     * The killed name maps to the new definition afterwards, even if {@code expr} reads it.
     * Every other definition whose expression reads the killed name is dropped.
     *
     * @param instrId    The id of the assigning instruction.
     * @param killedName The name assigned.
     * @param expr       The assigned expression.
     * @return The definitions after the assignment.
     */
    public UseDef applyAssign(int instrId, String killedName, Expr expr) {
        Map<String, Def> result = new LinkedHashMap<>();
        for (Map.Entry<String, Def> entry : defs.entrySet()) {
            if (entry.getKey().equals(killedName)) continue;
            if (entry.getValue().expr.use().contains(killedName)) continue;
            result.put(entry.getKey(), entry.getValue());
        }
        result.put(killedName, new Def(instrId, expr));
        return new UseDef(Collections.unmodifiableMap(result));
    }

    /**
     * Apply an assignment to part of a variable, such as one of its fields or elements.
     * <p>
     * No definition is recorded, since a read of the whole variable or of another part would not
     * see the assigned expression. The variable's own definition and every definition whose
     * expression reads it are dropped.
     *
     * @param rootName The name of the partly written variable.
     * @return The definitions after the assignment.
     */
    public UseDef applyPartialAssign(String rootName) {
        return without(Collections.singleton(rootName));
    }

    /**
     * Apply a call that destroys the given names.
     *
     * @param killed The names whose values the call destroys.
     * @return The definitions after the call.
     */
    public UseDef applyCall(Set<String> killed) {
        return without(killed);
    }

    private UseDef without(Set<String> killed) {
        Map<String, Def> result = new LinkedHashMap<>();
        outer:
        for (Map.Entry<String, Def> entry : defs.entrySet()) {
            if (killed.contains(entry.getKey())) continue;
            for (String used : entry.getValue().expr.use()) {
                if (killed.contains(used)) continue outer;
            }
            result.put(entry.getKey(), entry.getValue());
        }
        return of(result);
    }

    /**
     * Merge the definitions reaching from two paths. Only names that both paths define with
     * the same instruction are kept.
     *
     * @param other The definitions from the other path.
     * @return The merged definitions.
     */
    public UseDef join(UseDef other) {
        Map<String, Def> result = new LinkedHashMap<>();
        for (Map.Entry<String, Def> entry : defs.entrySet()) {
            Def theirs = other.defs.get(entry.getKey());
            if (theirs != null && theirs.instrId == entry.getValue().instrId) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return of(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return defs.equals(((UseDef) o).defs);
    }

    @Override
    public int hashCode() {
        return defs.hashCode();
    }

    @Override
    public String toString() {
        return defs.toString();
    }

    /**
     * A definition: the id of the defining instruction and the expression it assigned.
     */
    public static final class Def {
        public final int instrId;
        public final Expr expr;

        public Def(int instrId, Expr expr) {
            this.instrId = instrId;
            this.expr = expr;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Def def = (Def) o;
            return instrId == def.instrId && expr == def.expr;
        }

        @Override
        public int hashCode() {
            return Objects.hash(instrId, System.identityHashCode(expr));
        }

        @Override
        public String toString() {
            return "(" + instrId + ", " + expr + ")";
        }
    }
}
