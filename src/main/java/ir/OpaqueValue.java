package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import types.Type;

/**
 * Value producing instruction whose semantics are not modeled, e.g. "convert", "makemap" or "typeassert"
 */
public class OpaqueValue extends ValueInstruction {

    private final String op;
    private final List<Value> operands;

    public OpaqueValue(String name, Type type, String op, List<Value> operands) {
        super(name, type);
        this.op = op;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    /**
     * @return name of the operation
     */
    public String getOp() {
        return op;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.OPAQUE_VALUE;
    }

    @Override
    public List<Value> getOperands() {
        return operands;
    }
}
