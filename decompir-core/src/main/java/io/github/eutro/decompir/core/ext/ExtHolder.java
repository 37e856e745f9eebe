package io.github.eutro.decompir.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * A simple {@link ExtContainer} storing its values in an array indexed by ext id.
 */
public class ExtHolder implements ExtContainer {
    private static final Object[] EMPTY = new Object[0];
    private Object[] values = EMPTY;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext.id >= values.length) {
            values = Arrays.copyOf(values, Math.max(ext.id + 1, values.length * 2));
        }
        values[ext.id] = ext.check(value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext.id < values.length) {
            values[ext.id] = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return ext.id < values.length ? (T) values[ext.id] : null;
    }
}
