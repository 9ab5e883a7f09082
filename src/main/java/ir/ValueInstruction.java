package ir;

import types.Type;

/**
 * Instruction that defines a value
 */
public abstract class ValueInstruction extends Instruction implements Value {

    private final String name;
    private final Type type;

    protected ValueInstruction(String name, Type type) {
        assert name != null && type != null;
        this.name = name;
        this.type = type;
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
