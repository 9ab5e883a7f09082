package ir;

import types.Type;

/**
 * Free variable of an anonymous function, bound when the closure is created
 */
public final class FreeVar implements Value {

    private final String name;
    private final Type type;
    private final Function parent;

    FreeVar(String name, Type type, Function parent) {
        this.name = name;
        this.type = type;
        this.parent = parent;
    }

    public Function getParent() {
        return parent;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
