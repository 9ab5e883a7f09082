package ir;

import java.util.Collections;
import java.util.List;

/**
 * Abnormal termination of the function with the given value
 */
public class Panic extends Instruction {

    private final Value x;

    public Panic(Value x) {
        this.x = x;
    }

    public Value getX() {
        return x;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.PANIC;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.singletonList(x);
    }
}
