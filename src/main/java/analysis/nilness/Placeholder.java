package analysis.nilness;

import ir.Value;
import types.Type;

/**
 * Opaque value of a given type, minted for outcomes that are computed rather than read off the program
 */
final class Placeholder implements Value {

    private final Type type;

    Placeholder(Type type) {
        this.type = type;
    }

    @Override
    public String getName() {
        return "?:" + type;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return getName();
    }
}
