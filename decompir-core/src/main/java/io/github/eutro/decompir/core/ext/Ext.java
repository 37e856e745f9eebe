package io.github.eutro.decompir.core.ext;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for data attached to an {@link ExtContainer}.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    final int id = ID_COUNTER.getAndIncrement();
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class is only used for checking at attach time, so generic types
     * can be given by their raw class.
     *
     * @param type The class of values of this ext.
     * @param name A name for debugging.
     * @param <T>  The type of values.
     * @return The new ext.
     */
    public static <T> Ext<T> create(Class<? super T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Check that a value can be attached under this ext.
     *
     * @param value The value.
     * @return The value.
     */
    T check(T value) {
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException("value " + value + " is not of type " + type.getName() + " for ext " + name);
        }
        return value;
    }

    @Override
    public String toString() {
        return name;
    }
}
