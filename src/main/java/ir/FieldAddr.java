package ir;

import java.util.Collections;
import java.util.List;

import types.PointerType;
import types.StructType;
import types.Type;

/**
 * Address of a field of the struct pointed to by x, i.e. &amp;x.f. This is where a nil pointer is dereferenced.
 */
public class FieldAddr extends ValueInstruction {

    private final Value x;
    private final int field;

    public FieldAddr(String name, Type type, Value x, int field) {
        super(name, type);
        assert x.getType().isPointerToStruct() : "Base of field address must be a pointer to a struct: "
                + x.getType();
        this.x = x;
        this.field = field;
    }

    /**
     * @return pointer to the struct
     */
    public Value getX() {
        return x;
    }

    public int getFieldIndex() {
        return field;
    }

    public String getFieldName() {
        StructType st = (StructType) ((PointerType) x.getType().getUnderlying()).getElem().getUnderlying();
        return st.getFields().get(field).getName();
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.FIELD_ADDR;
    }

    @Override
    public List<Value> getOperands() {
        return Collections.singletonList(x);
    }
}
