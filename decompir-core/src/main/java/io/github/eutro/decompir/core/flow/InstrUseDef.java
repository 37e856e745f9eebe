package io.github.eutro.decompir.core.flow;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The reaching definitions on entry to each statement and instruction of a tree, keyed by node id.
 */
public final class InstrUseDef {
    private final Map<Integer, UseDef> entries = new LinkedHashMap<>();

    public void put(int id, UseDef useDef) {
        entries.put(id, useDef);
    }

    public boolean has(int id) {
        return entries.containsKey(id);
    }

    /**
     * Get the definitions reaching a node. Check {@link #has(int)} first.
     *
     * @param id The id of the node.
     * @return The definitions.
     * @throws NoSuchElementException If nothing was recorded for the node.
     */
    public UseDef get(int id) {
        UseDef useDef = entries.get(id);
        if (useDef == null) throw new NoSuchElementException("no use-def recorded for node " + id);
        return useDef;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
