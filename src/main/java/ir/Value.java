package ir;

import types.Type;

/**
 * A typed value in the control flow graph: the result of an instruction, a constant, a global, a parameter, a free
 * variable or a function
 */
public interface Value {

    /**
     * Name of the value, e.g. "t3" for an instruction result or "ok" for a parameter
     *
     * @return name used when printing the value as an operand
     */
    String getName();

    /**
     * @return static type of the value
     */
    Type getType();
}
