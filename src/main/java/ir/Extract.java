package ir;

import java.util.Collections;
import java.util.List;

import types.Type;

/**
 * Component of a tuple, e.g. the second result of a call or the "ok" flag of a comma-ok map lookup
 */
public class Extract extends ValueInstruction {

    private final Value tuple;
    private final int index;

    public Extract(String name, Type type, Value tuple, int index) {
        super(name, type);
        this.tuple = tuple;
        this.index = index;
    }

    public Value getTuple() {
        return tuple;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.EXTRACT;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.singletonList(tuple);
    }
}
