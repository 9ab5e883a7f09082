package ir;

import java.util.Arrays;
import java.util.List;

import types.Type;

/**
 * x op y
 */
public class BinOp extends ValueInstruction {

    private final BinaryOperator op;
    private final Value x;
    private final Value y;

    public BinOp(String name, Type type, BinaryOperator op, Value x, Value y) {
        super(name, type);
        this.op = op;
        this.x = x;
        this.y = y;
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Value getX() {
        return x;
    }

    public Value getY() {
        return y;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.BINARY_OP;
    }

    @Override
    public List<Value> getOperands() {
        return Arrays.asList(x, y);
    }
}
