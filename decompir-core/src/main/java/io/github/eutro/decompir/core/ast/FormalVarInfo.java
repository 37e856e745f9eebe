package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.conf.CallingConvention;
import io.github.eutro.decompir.core.types.CType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A formal parameter, together with where its value is found on entry to the function.
 * <p>
 * Usually a formal lives in a single register or stack slot, but a struct passed by value
 * may be spread over several, each holding one field (or one byte of a packed byte array).
 */
public final class FormalVarInfo extends VarInfo {
    /**
     * The zero-based index of the first binary argument word this formal occupies.
     */
    public final int firstArgIndex;
    private final List<ArgLocation> argLocations = new ArrayList<>();

    public FormalVarInfo(
            int id,
            String name,
            @Nullable CType type,
            @Nullable String altname,
            int parameter,
            int firstArgIndex
    ) {
        super(id, name, type, altname, parameter, null);
        this.firstArgIndex = firstArgIndex;
    }

    public List<ArgLocation> getArgLocations() {
        return Collections.unmodifiableList(argLocations);
    }

    public int argLocationCount() {
        return argLocations.size();
    }

    /**
     * Get an argument location by index.
     *
     * @param index The index.
     * @return The location.
     * @throws IllegalArgumentException If there is no such location.
     */
    public ArgLocation argLocation(int index) {
        if (index < 0 || index >= argLocations.size()) {
            throw new IllegalArgumentException("formal " + name + ": illegal index: " + index
                    + " (number of argument locations: " + argLocations.size() + ")");
        }
        return argLocations.get(index);
    }

    /**
     * Get the number of argument words this formal occupies.
     *
     * @return The total size of the locations, in 4-byte words.
     */
    public int wordCount() {
        int bytes = 0;
        for (ArgLocation loc : argLocations) bytes += loc.size;
        return bytes / 4;
    }

    /**
     * Find the locations whose bytes belong to the given binary argument.
     *
     * @param argIndex The index of the binary argument.
     * @return The indices into {@link #getArgLocations()}.
     */
    public List<Integer> argLocationsForArgIndex(int argIndex) {
        List<Integer> result = new ArrayList<>();
        int low = 4 * (argIndex - firstArgIndex);
        int high = low + 4;
        int offset = 0;
        for (int i = 0; i < argLocations.size(); i++) {
            if (offset >= low && offset < high) result.add(i);
            offset += argLocations.get(i).size;
        }
        return result;
    }

    /**
     * Lay out the argument locations of this formal according to a calling convention.
     *
     * @param convention The calling convention.
     * @param argType    The type of the argument in the binary.
     * @return The index of the first argument word after this formal.
     */
    public int initialize(CallingConvention convention, CType argType) {
        if (!argLocations.isEmpty()) {
            throw new IllegalStateException("formal " + name + " is already initialized");
        }
        if (argType.isScalar()) {
            argLocations.add(new ArgLocation(convention.argLocation(firstArgIndex * 4, 4), NoOffset.INSTANCE, 4));
            return firstArgIndex + 1;
        }
        if (convention == CallingConvention.ARM && argType.isStruct()) {
            CType.Struct struct = (CType.Struct) argType;
            int byteCounter = 4 * firstArgIndex;
            for (CType.Struct.Field field : struct.fields) {
                if (field.type.isArray()) {
                    CType.Array array = (CType.Array) field.type;
                    if (array.length == null || array.element.byteSize() != 1) continue;
                    for (int i = 0; i < array.length; i++) {
                        IndexOffset element = new IndexOffset(
                                Node.NO_ID,
                                new IntegerConstant(Node.NO_ID, i, null),
                                NoOffset.INSTANCE);
                        argLocations.add(new ArgLocation(
                                convention.argLocation(byteCounter, 1),
                                new FieldOffset(Node.NO_ID, field.name, field.type, element),
                                1));
                        byteCounter++;
                    }
                } else if (field.type.byteSize() <= 4) {
                    int size = field.type.byteSize();
                    argLocations.add(new ArgLocation(
                            convention.argLocation(byteCounter, size),
                            new FieldOffset(Node.NO_ID, field.name, field.type, NoOffset.INSTANCE),
                            size));
                    byteCounter += size;
                }
            }
            return byteCounter / 4;
        }
        throw new IllegalArgumentException("cannot pass argument of type " + argType + " under " + convention);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString()).append(" (");
        for (int i = 0; i < argLocations.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(argLocations.get(i));
        }
        return sb.append(')').toString();
    }

    /**
     * One location that holds (part of) a formal on entry.
     */
    public static final class ArgLocation {
        /**
         * The location token, like {@code R0}, {@code R1:2} or {@code stack:16}.
         */
        public final String location;
        /**
         * The part of the formal held here.
         */
        public final Offset offset;
        /**
         * The number of bytes held here.
         */
        public final int size;

        public ArgLocation(String location, Offset offset, int size) {
            this.location = location;
            this.offset = offset;
            this.size = size;
        }

        @Override
        public String toString() {
            return offset instanceof NoOffset ? location : location + ": " + offset;
        }
    }
}
