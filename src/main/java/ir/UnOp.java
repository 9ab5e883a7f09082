package ir;

import java.util.Collections;
import java.util.List;

import types.Type;

/**
 * Unary operation: "-", "!", "^", the pointer load "*" or the channel receive "&lt;-"
 */
public class UnOp extends ValueInstruction {

    private final String op;
    private final Value x;
    private final boolean commaOk;

    public UnOp(String name, Type type, String op, Value x, boolean commaOk) {
        super(name, type);
        this.op = op;
        this.x = x;
        this.commaOk = commaOk;
    }

    public String getOperator() {
        return op;
    }

    /**
     * @return true if this is a pointer load
     */
    public boolean isLoad() {
        return "*".equals(op);
    }

    public Value getX() {
        return x;
    }

    /**
     * @return true for a receive of the form "v, ok := &lt;-ch"
     */
    public boolean isCommaOk() {
        return commaOk;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.UNARY_OP;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.singletonList(x);
    }
}
