package io.github.eutro.decompir.core.build;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies variable names by the storage they denote.
 */
public final class StorageRecords {
    public static final Set<String> ARM_REGISTERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "R0", "R1", "R2", "R3", "R4", "R5", "R6", "R7", "R8", "R9", "R10", "R11", "R12",
            "SP", "LR", "PC")));
    public static final String GLOBAL_PREFIX = "gv_";
    public static final String STACK_PREFIX = "var.";

    private StorageRecords() {
    }

    /**
     * Get the storage records of the names that denote a register, global or stack slot.
     * Other names are skipped.
     *
     * @param names The names.
     * @return The records, in the order of the names.
     */
    public static List<Record> of(Collection<String> names) {
        List<Record> records = new ArrayList<>();
        for (String name : names) {
            Record record = classify(name);
            if (record != null) records.add(record);
        }
        return records;
    }

    public static @Nullable Record classify(String name) {
        if (ARM_REGISTERS.contains(name)) {
            return new Record(name, Kind.REGISTER, null, null);
        }
        if (name.startsWith(GLOBAL_PREFIX)) {
            return new Record(name, Kind.GLOBAL, name.substring(GLOBAL_PREFIX.length()), null);
        }
        if (name.startsWith(STACK_PREFIX)) {
            try {
                return new Record(name, Kind.STACK, null, Integer.parseInt(name.substring(STACK_PREFIX.length())));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public enum Kind {
        REGISTER("register"),
        GLOBAL("global"),
        STACK("stack"),
        ;

        public final String tag;

        Kind(String tag) {
            this.tag = tag;
        }
    }

    public static final class Record {
        public final String name;
        public final Kind kind;
        /**
         * The address text of a global, like {@code 0x2a010}.
         */
        @Nullable
        public final String va;
        /**
         * The frame offset of a stack slot.
         */
        @Nullable
        public final Integer offset;

        Record(String name, Kind kind, @Nullable String va, @Nullable Integer offset) {
            this.name = name;
            this.kind = kind;
            this.va = va;
            this.offset = offset;
        }

        @Override
        public String toString() {
            switch (kind) {
                case GLOBAL:
                    return name + ": global " + va;
                case STACK:
                    return name + ": stack " + offset;
                default:
                    return name + ": register";
            }
        }
    }
}
