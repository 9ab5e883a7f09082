package ir;

import java.util.Collections;
import java.util.List;

/**
 * Conditional branch: the first successor of the block is taken if the condition is true, the second otherwise
 */
public class If extends Instruction {

    private final Value cond;

    public If(Value cond) {
        this.cond = cond;
    }

    public Value getCond() {
        return cond;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.IF;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.singletonList(cond);
    }
}
