package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import types.Type;

/**
 * Function call. The callee is either a value (a function, a closure, or any other value of function type) or, for a
 * dynamically dispatched call, a method name invoked on a receiver of interface type.
 */
public class Call extends ValueInstruction {

    /**
     * How the callee is determined
     */
    public enum Mode {
        /**
         * Direct call of a function known statically
         */
        STATIC,
        /**
         * Call of a closure created by a {@link MakeClosure} instruction
         */
        CLOSURE,
        /**
         * Call through a function value that is not known statically
         */
        FUNCTION_VALUE,
        /**
         * Dynamically dispatched interface method call
         */
        INVOKE
    }

    /**
     * Callee value, null for an invoke
     */
    private final Value function;
    /**
     * Receiver for an invoke, null otherwise
     */
    private final Value receiver;
    /**
     * Method name for an invoke, null otherwise
     */
    private final String method;
    private final List<Value> args;

    private Call(String name, Type type, Value function, Value receiver, String method, List<Value> args) {
        super(name, type);
        this.function = function;
        this.receiver = receiver;
        this.method = method;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Call of the given callee value
     *
     * @param name name of the result
     * @param type type of the result, a tuple if the callee has zero or several results
     * @param function callee
     * @param args actual arguments
     * @return new call instruction
     */
    public static Call call(String name, Type type, Value function, List<Value> args) {
        assert function != null;
        return new Call(name, type, function, null, null, args);
    }

    /**
     * Dynamically dispatched call of a method on an interface value
     *
     * @param name name of the result
     * @param type type of the result
     * @param receiver interface value
     * @param method name of the method
     * @param args actual arguments, not including the receiver
     * @return new call instruction
     */
    public static Call invoke(String name, Type type, Value receiver, String method, List<Value> args) {
        assert receiver != null && method != null;
        return new Call(name, type, null, receiver, method, args);
    }

    public Mode getMode() {
        if (function == null) {
            return Mode.INVOKE;
        }
        if (function instanceof Function) {
            return Mode.STATIC;
        }
        if (function instanceof MakeClosure) {
            return Mode.CLOSURE;
        }
        return Mode.FUNCTION_VALUE;
    }

    /**
     * @return true for a dynamically dispatched call
     */
    public boolean isInvoke() {
        return function == null;
    }

    /**
     * Function called if it can be determined without evaluating anything, i.e. for a static or a closure call
     *
     * @return callee or null
     */
    public Function getStaticCallee() {
        switch (getMode()) {
        case STATIC:
            return (Function) function;
        case CLOSURE:
            return ((MakeClosure) function).getFunction();
        default:
            return null;
        }
    }

    /**
     * Values bound to the free variables of the callee for a closure call
     *
     * @return bindings or null if this is not a closure call
     */
    public List<Value> getBindings() {
        if (getMode() == Mode.CLOSURE) {
            return ((MakeClosure) function).getBindings();
        }
        return null;
    }

    /**
     * @return callee value, null for an invoke
     */
    public Value getFunctionValue() {
        return function;
    }

    public Value getReceiver() {
        return receiver;
    }

    public String getMethod() {
        return method;
    }

    public List<Value> getArgs() {
        return args;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.CALL;
    }

    @Override
    public List<Value> getOperands() {
        List<Value> ops = new ArrayList<>(args.size() + 1);
        ops.add(function == null ? receiver : function);
        ops.addAll(args);
        return ops;
    }
}
