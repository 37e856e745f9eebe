package io.github.eutro.decompir.core.build;

/**
 * Hands out node ids for one function.
 * <p>
 * Ids increase monotonically from the starting value and are never reused.
 */
public final class IdAllocator {
    private int next;

    public IdAllocator() {
        this(0);
    }

    public IdAllocator(int start) {
        if (start < 0) throw new IllegalArgumentException("negative starting id: " + start);
        this.next = start;
    }

    public int newId() {
        return next++;
    }

    /**
     * Get the id the next call to {@link #newId()} will return.
     *
     * @return The next id.
     */
    public int peek() {
        return next;
    }
}
