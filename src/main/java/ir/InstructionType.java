package ir;

/**
 * Enumeration of instruction kinds, used to dispatch transfer functions
 */
public enum InstructionType {
    /**
     * new(T), local or heap allocation
     *
     * @see Alloc
     */
    ALLOC,
    /**
     * x op y
     *
     * @see BinOp
     */
    BINARY_OP,
    /**
     * op x, including the pointer load *x
     *
     * @see UnOp
     */
    UNARY_OP,
    /**
     * Call of a function, closure, function value or interface method
     *
     * @see Call
     */
    CALL,
    /**
     * Closure creation binding free variables
     *
     * @see MakeClosure
     */
    MAKE_CLOSURE,
    /**
     * Component of a tuple valued instruction
     *
     * @see Extract
     */
    EXTRACT,
    /**
     * &amp;x.f where x is a pointer to a struct
     *
     * @see FieldAddr
     */
    FIELD_ADDR,
    /**
     * m[k] on a map or string
     *
     * @see Lookup
     */
    LOOKUP,
    /**
     * SSA phi node
     *
     * @see Phi
     */
    PHI,
    /**
     * Value producing instruction that is not modeled, e.g. a conversion
     *
     * @see OpaqueValue
     */
    OPAQUE_VALUE,
    /**
     * Instruction executed only for its effect that is not modeled, e.g. a store
     *
     * @see OpaqueInstruction
     */
    OPAQUE_EFFECT,
    /**
     * Conditional branch, terminates a block
     *
     * @see If
     */
    IF,
    /**
     * Unconditional branch, terminates a block
     *
     * @see Jump
     */
    JUMP,
    /**
     * Abnormal termination, terminates a block
     *
     * @see Panic
     */
    PANIC,
    /**
     * Normal termination, terminates a block
     *
     * @see Return
     */
    RETURN;

    /**
     * @return true if instructions of this kind end a basic block
     */
    public boolean isTerminator() {
        return this == IF || this == JUMP || this == PANIC || this == RETURN;
    }
}
