package io.github.eutro.decompir.core.conf;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The parts of a target ABI that the analyses depend on.
 */
public enum CallingConvention {
    /**
     * The standard ARM procedure call standard: arguments in {@code R0-R3}, which a call may clobber.
     */
    ARM(new String[]{"R0", "R1", "R2", "R3"}, new String[]{"R0", "R1", "R2", "R3"}, 0),
    /**
     * MIPS O32: arguments in {@code $a0-$a3}, results in {@code $v0-$v1}, with stack home slots for the register arguments.
     */
    MIPS(new String[]{"$v0", "$v1"}, new String[]{"$a0", "$a1", "$a2", "$a3"}, 16),
    ;

    private final Set<String> callKillSet;
    private final String[] argRegisters;
    private final int stackBase;

    CallingConvention(String[] clobbered, String[] argRegisters, int stackBase) {
        this.callKillSet = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(clobbered)));
        this.argRegisters = argRegisters;
        this.stackBase = stackBase;
    }

    /**
     * Get the registers whose value is destroyed by any call.
     *
     * @return The caller-saved registers.
     */
    public Set<String> getCallKillSet() {
        return callKillSet;
    }

    /**
     * Get the location an argument byte is passed in.
     *
     * @param byteOffset The offset of the byte in the argument area.
     * @param size       The size of the value at that offset.
     * @return A register name, with a {@code :byte} suffix for values smaller than a register,
     * or {@code stack:offset}.
     */
    public String argLocation(int byteOffset, int size) {
        if (byteOffset < 0) throw new IllegalArgumentException("negative argument offset: " + byteOffset);
        int registerBytes = argRegisters.length * 4;
        if (byteOffset < registerBytes) {
            String register = argRegisters[byteOffset / 4];
            return size < 4 ? register + ":" + (byteOffset % 4) : register;
        }
        return "stack:" + (byteOffset - registerBytes + stackBase);
    }

    /**
     * Look up a convention by its lowercase name, as used in configuration.
     *
     * @param name The name, like {@code "arm"}.
     * @return The convention.
     */
    public static CallingConvention fromName(String name) {
        for (CallingConvention cc : values()) {
            if (cc.name().toLowerCase(Locale.ROOT).equals(name)) return cc;
        }
        throw new IllegalArgumentException("calling convention " + name + " not recognized");
    }
}
