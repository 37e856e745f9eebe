package io.github.eutro.decompir.core.types;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An opaque C type token, as attached to variables, fields and casts.
 * <p>
 * Types are only carried and displayed here; they are produced and compared by an external type system.
 */
public abstract class CType {
    private static final Map<String, String> IKIND_NAMES = new HashMap<>();
    private static final Map<String, Integer> IKIND_SIZES = new HashMap<>();

    static {
        ikind("ichar", "char", 1);
        ikind("ischar", "signed char", 1);
        ikind("iuchar", "unsigned char", 1);
        ikind("ibool", "bool", 1);
        ikind("ishort", "short", 2);
        ikind("iushort", "unsigned short", 2);
        ikind("iint", "int", 4);
        ikind("iuint", "unsigned int", 4);
        ikind("ilong", "long", 4);
        ikind("iulong", "unsigned long", 4);
        ikind("ilonglong", "long long", 8);
        ikind("iulonglong", "unsigned long long", 8);
    }

    private static void ikind(String kind, String name, int size) {
        IKIND_NAMES.put(kind, name);
        IKIND_SIZES.put(kind, size);
    }

    CType() {
    }

    /**
     * Get the kind of this type, used as its tag when serialized.
     *
     * @return The kind.
     */
    public abstract String getKind();

    public abstract String toCLike();

    /**
     * Get the size of a value of this type in bytes.
     *
     * @return The size.
     * @throws UnsupportedOperationException If the size is not known.
     */
    public int byteSize() {
        throw new UnsupportedOperationException("size of " + toCLike() + " is not known");
    }

    public boolean isScalar() {
        return false;
    }

    public boolean isPointer() {
        return false;
    }

    public boolean isStruct() {
        return false;
    }

    public boolean isArray() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return toCLike().equals(((CType) o).toCLike());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), toCLike());
    }

    @Override
    public String toString() {
        return toCLike();
    }

    public static Named named(String name) {
        return new Named(name);
    }

    public static VoidType voidType() {
        return VoidType.INSTANCE;
    }

    public static Int integer(String ikind) {
        return new Int(ikind);
    }

    public static Ptr pointer(CType target) {
        return new Ptr(target);
    }

    public static Array array(CType element, @Nullable Integer length) {
        return new Array(element, length);
    }

    public static Struct struct(String name, List<Struct.Field> fields) {
        return new Struct(name, fields);
    }

    public static Fun function(CType returnType, List<Fun.Param> params) {
        return new Fun(returnType, params);
    }

    /**
     * A type referred to by name only, such as a typedef.
     */
    public static final class Named extends CType {
        public final String name;

        Named(String name) {
            this.name = name;
        }

        @Override
        public String getKind() {
            return "named";
        }

        @Override
        public String toCLike() {
            return name;
        }
    }

    public static final class VoidType extends CType {
        static final VoidType INSTANCE = new VoidType();

        private VoidType() {
        }

        @Override
        public String getKind() {
            return "void";
        }

        @Override
        public String toCLike() {
            return "void";
        }
    }

    /**
     * An integer type, identified by its CIL ikind, like {@code iint} or {@code iuchar}.
     */
    public static final class Int extends CType {
        public final String ikind;

        Int(String ikind) {
            if (!IKIND_NAMES.containsKey(ikind)) {
                throw new IllegalArgumentException("unknown integer kind: " + ikind);
            }
            this.ikind = ikind;
        }

        @Override
        public String getKind() {
            return "int";
        }

        @Override
        public String toCLike() {
            return IKIND_NAMES.get(ikind);
        }

        @Override
        public int byteSize() {
            return IKIND_SIZES.get(ikind);
        }

        @Override
        public boolean isScalar() {
            return true;
        }
    }

    public static final class Ptr extends CType {
        public final CType target;

        Ptr(CType target) {
            this.target = target;
        }

        @Override
        public String getKind() {
            return "ptr";
        }

        @Override
        public String toCLike() {
            return target.toCLike() + " *";
        }

        @Override
        public int byteSize() {
            return 4;
        }

        @Override
        public boolean isScalar() {
            return true;
        }

        @Override
        public boolean isPointer() {
            return true;
        }
    }

    public static final class Array extends CType {
        public final CType element;
        /**
         * The number of elements, if constant.
         */
        @Nullable
        public final Integer length;

        Array(CType element, @Nullable Integer length) {
            this.element = element;
            this.length = length;
        }

        @Override
        public String getKind() {
            return "array";
        }

        @Override
        public String toCLike() {
            return element.toCLike() + "[" + (length == null ? "" : length.toString()) + "]";
        }

        @Override
        public int byteSize() {
            if (length == null) return super.byteSize();
            return element.byteSize() * length;
        }

        @Override
        public boolean isArray() {
            return true;
        }
    }

    /**
     * A struct type, with its fields in layout order.
     */
    public static final class Struct extends CType {
        public final String name;
        public final List<Field> fields;

        Struct(String name, List<Field> fields) {
            this.name = name;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        @Override
        public String getKind() {
            return "struct";
        }

        @Override
        public String toCLike() {
            return "struct " + name;
        }

        @Override
        public int byteSize() {
            int size = 0;
            for (Field field : fields) size += field.type.byteSize();
            return size;
        }

        @Override
        public boolean isStruct() {
            return true;
        }

        public static final class Field {
            public final String name;
            public final CType type;

            public Field(String name, CType type) {
                this.name = name;
                this.type = type;
            }
        }
    }

    public static final class Fun extends CType {
        public final CType returnType;
        public final List<Param> params;

        Fun(CType returnType, List<Param> params) {
            this.returnType = returnType;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
        }

        @Override
        public String getKind() {
            return "fun";
        }

        @Override
        public String toCLike() {
            StringBuilder sb = new StringBuilder(returnType.toCLike()).append(" (");
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(params.get(i).type.toCLike()).append(' ').append(params.get(i).name);
            }
            return sb.append(')').toString();
        }

        public static final class Param {
            public final String name;
            public final CType type;

            public Param(String name, CType type) {
                this.name = name;
                this.type = type;
            }
        }
    }
}
