package types;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Predeclared scalar types
 */
public final class BasicType extends Type {

    /**
     * Classification of the predeclared types
     */
    public enum Kind {
        BOOLEAN, INTEGER, FLOAT, COMPLEX, STRING, UNSAFE_POINTER, UNTYPED_NIL
    }

    private static final Map<String, BasicType> predeclared = new LinkedHashMap<>();

    public static final BasicType BOOL = declare("bool", Kind.BOOLEAN);
    public static final BasicType INT = declare("int", Kind.INTEGER);
    public static final BasicType STRING = declare("string", Kind.STRING);
    public static final BasicType UNTYPED_NIL = declare("untyped nil", Kind.UNTYPED_NIL);

    static {
        for (String name : new String[] { "int8", "int16", "int32", "int64", "uint", "uint8", "uint16", "uint32",
                "uint64", "uintptr", "byte", "rune" }) {
            declare(name, Kind.INTEGER);
        }
        declare("float32", Kind.FLOAT);
        declare("float64", Kind.FLOAT);
        declare("complex64", Kind.COMPLEX);
        declare("complex128", Kind.COMPLEX);
        declare("unsafe.Pointer", Kind.UNSAFE_POINTER);
    }

    private final String name;
    private final Kind kind;

    private BasicType(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    private static BasicType declare(String name, Kind kind) {
        BasicType t = new BasicType(name, kind);
        predeclared.put(name, t);
        return t;
    }

    /**
     * Look up a predeclared type by name
     *
     * @param name Go name of the type, e.g. "int64"
     * @return the type or null if there is no such predeclared type
     */
    public static BasicType forName(String name) {
        return predeclared.get(name);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
