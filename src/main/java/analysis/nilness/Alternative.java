package analysis.nilness;

import ir.Value;

/**
 * One statically distinguishable outcome of a value: whether it is the zero value of its type, and, for a pointer,
 * whether the storage it points to is known to hold a zero value
 */
public final class Alternative {

    /**
     * Representative value, an opaque placeholder when the outcome is computed rather than read off the program
     */
    private final Value value;
    private final boolean zero;
    private final boolean pointeeZero;

    public Alternative(Value value, boolean zero, boolean pointeeZero) {
        this.value = value;
        this.zero = zero;
        this.pointeeZero = pointeeZero;
    }

    public static Alternative zero(Value value) {
        return new Alternative(value, true, false);
    }

    public static Alternative nonZero(Value value) {
        return new Alternative(value, false, false);
    }

    public Value getValue() {
        return value;
    }

    /**
     * @return true if the value is nil, false, 0 or "" in this outcome
     */
    public boolean isZero() {
        return zero;
    }

    /**
     * @return true if the value points to storage that holds a zero value in this outcome
     */
    public boolean isPointeeZero() {
        return pointeeZero;
    }

    @Override
    public String toString() {
        return (zero ? "zero" : "non-zero") + (pointeeZero ? "->zero" : "");
    }
}
