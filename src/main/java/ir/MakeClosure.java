package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import types.Type;

/**
 * Creation of a closure: an anonymous function together with the values bound to its free variables
 */
public class MakeClosure extends ValueInstruction {

    private final Function fn;
    private final List<Value> bindings;

    public MakeClosure(String name, Type type, Function fn, List<Value> bindings) {
        super(name, type);
        this.fn = fn;
        this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
    }

    public Function getFunction() {
        return fn;
    }

    /**
     * @return values bound to the free variables of the function, in order
     */
    public List<Value> getBindings() {
        return bindings;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.MAKE_CLOSURE;
    }

    @Override
    public List<Value> getOperands() {
        List<Value> ops = new ArrayList<>(bindings.size() + 1);
        ops.add(fn);
        ops.addAll(bindings);
        return ops;
    }
}
