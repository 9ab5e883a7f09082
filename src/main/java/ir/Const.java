package ir;

import java.math.BigDecimal;

import types.BasicType;
import types.Type;

/**
 * Constant: nil of a pointer, map, channel, slice, function or interface type, or a boolean, numeric or string literal
 */
public final class Const implements Value {

    /**
     * Kind of literal held by a constant
     */
    public enum Kind {
        NIL, BOOLEAN, NUMBER, COMPLEX, STRING
    }

    private final Type type;
    private final Kind kind;
    /**
     * Boolean, BigDecimal, String, or double[2] for a complex number, null for nil
     */
    private final Object value;

    private Const(Type type, Kind kind, Object value) {
        this.type = type;
        this.kind = kind;
        this.value = value;
    }

    public static Const nil(Type type) {
        return new Const(type, Kind.NIL, null);
    }

    public static Const bool(boolean b, Type type) {
        return new Const(type, Kind.BOOLEAN, b);
    }

    public static Const bool(boolean b) {
        return bool(b, BasicType.BOOL);
    }

    public static Const number(Number n, Type type) {
        BigDecimal d = n instanceof BigDecimal ? (BigDecimal) n : new BigDecimal(n.toString());
        return new Const(type, Kind.NUMBER, d);
    }

    public static Const complex(double re, double im, Type type) {
        return new Const(type, Kind.COMPLEX, new double[] { re, im });
    }

    public static Const string(String s, Type type) {
        return new Const(type, Kind.STRING, s);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNil() {
        return kind == Kind.NIL;
    }

    /**
     * Whether this constant is the zero value of its type: nil, false, 0 or ""
     *
     * @return true if the literal is a zero value
     */
    public boolean isZero() {
        switch (kind) {
        case NIL:
            return true;
        case BOOLEAN:
            return !((Boolean) value);
        case NUMBER:
            return ((BigDecimal) value).signum() == 0;
        case COMPLEX:
            double[] c = (double[]) value;
            return c[0] == 0 && c[1] == 0;
        case STRING:
            return ((String) value).isEmpty();
        default:
            throw new RuntimeException("Unknown constant kind " + kind);
        }
    }

    /**
     * @return the literal, null for nil
     */
    public Object getValue() {
        return value;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String getName() {
        String lit;
        switch (kind) {
        case NIL:
            lit = "nil";
            break;
        case STRING:
            lit = "\"" + value + "\"";
            break;
        case COMPLEX:
            double[] c = (double[]) value;
            lit = "(" + c[0] + "+" + c[1] + "i)";
            break;
        case NUMBER:
            lit = ((BigDecimal) value).toPlainString();
            break;
        default:
            lit = String.valueOf(value);
        }
        return lit + ":" + type;
    }

    @Override
    public String toString() {
        return getName();
    }
}
