package ir;

import java.util.List;

/**
 * Instruction in a basic block
 */
public abstract class Instruction {

    /**
     * Containing basic block, set when the instruction is added to a block
     */
    private BasicBlock block;
    /**
     * Position recorded by the frontend, or null
     */
    private SourcePosition position;
    /**
     * Rendering of the source expression recorded by the frontend, or null
     */
    private String source;

    /**
     * @return kind of this instruction
     */
    public abstract InstructionType getInstructionType();

    /**
     * Values used by this instruction, in order
     *
     * @return operands
     */
    public abstract List<Value> getOperands();

    public BasicBlock getBlock() {
        return block;
    }

    void setBlock(BasicBlock block) {
        assert this.block == null : "Instruction already in block " + this.block;
        this.block = block;
    }

    /**
     * @return function containing this instruction
     */
    public Function getFunction() {
        return block == null ? null : block.getFunction();
    }

    /**
     * Record where this instruction came from
     *
     * @param position source position, may be null
     * @param source rendering of the source expression, may be null
     */
    public void setSource(SourcePosition position, String source) {
        this.position = position;
        this.source = source;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public String getSource() {
        return source;
    }

    public boolean isTerminator() {
        return getInstructionType().isTerminator();
    }
}
