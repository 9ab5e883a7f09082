package ir;

import java.util.Collections;
import java.util.List;

import types.PointerType;
import types.Type;

/**
 * Allocation of a zero-initialized variable. The value is the (never nil) address of the new variable.
 */
public class Alloc extends ValueInstruction {

    /**
     * True for new(T) and escaping locals, false for stack locals
     */
    private final boolean heap;

    public Alloc(String name, Type type, boolean heap) {
        super(name, type);
        assert type.isPointer() : "Allocation must have pointer type, not " + type;
        this.heap = heap;
    }

    public boolean isHeap() {
        return heap;
    }

    /**
     * @return type of the allocated variable
     */
    public Type getAllocatedType() {
        return ((PointerType) getType().getUnderlying()).getElem();
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.ALLOC;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.emptyList();
    }
}
