package ir;

import java.util.Arrays;
import java.util.List;

import types.Type;

/**
 * x[index] where x is a map or a string. With the comma-ok flag set the result is the tuple (value, ok).
 */
public class Lookup extends ValueInstruction {

    private final Value x;
    private final Value index;
    private final boolean commaOk;

    public Lookup(String name, Type type, Value x, Value index, boolean commaOk) {
        super(name, type);
        this.x = x;
        this.index = index;
        this.commaOk = commaOk;
    }

    public Value getX() {
        return x;
    }

    public Value getIndex() {
        return index;
    }

    public boolean isCommaOk() {
        return commaOk;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.LOOKUP;
    }

    @Override
    public List<Value> getOperands() {
        return Arrays.asList(x, index);
    }
}
