package io.github.eutro.decompir.core.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * The names live on exit from each statement and instruction of a tree, keyed by node id.
 */
public final class LiveVars {
    private final Map<Integer, Set<String>> liveExit = new LinkedHashMap<>();

    public void put(int id, Set<String> live) {
        liveExit.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(live)));
    }

    public boolean has(int id) {
        return liveExit.containsKey(id);
    }

    /**
     * Get the names live on exit from a node. Check {@link #has(int)} first.
     *
     * @param id The id of the node.
     * @return The live names.
     * @throws NoSuchElementException If nothing was recorded for the node.
     */
    public Set<String> get(int id) {
        Set<String> live = liveExit.get(id);
        if (live == null) throw new NoSuchElementException("no liveness recorded for node " + id);
        return live;
    }

    public int size() {
        return liveExit.size();
    }

    @Override
    public String toString() {
        return liveExit.toString();
    }
}
