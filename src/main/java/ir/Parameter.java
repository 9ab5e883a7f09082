package ir;

import types.Type;

/**
 * Formal parameter of a function
 */
public final class Parameter implements Value {

    private final String name;
    private final Type type;
    private final Function parent;

    Parameter(String name, Type type, Function parent) {
        this.name = name;
        this.type = type;
        this.parent = parent;
    }

    /**
     * @return function this is a parameter of
     */
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
