package ir;

import java.util.Collections;
import java.util.List;

/**
 * Unconditional branch to the only successor of the block
 */
public class Jump extends Instruction {

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.JUMP;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.emptyList();
    }
}
