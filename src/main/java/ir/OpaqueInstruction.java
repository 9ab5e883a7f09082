package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Instruction executed for its effect whose semantics are not modeled, e.g. "store" or "send"
 */
public class OpaqueInstruction extends Instruction {

    private final String op;
    private final List<Value> operands;

    public OpaqueInstruction(String op, List<Value> operands) {
        this.op = op;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public String getOp() {
        return op;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.OPAQUE_EFFECT;
    }

    @Override
    public List<Value> getOperands() {
        return operands;
    }
}
