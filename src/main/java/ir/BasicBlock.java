package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Basic block: a sequence of instructions ending in a terminator, and the successors the terminator may branch to
 */
public final class BasicBlock implements Iterable<Instruction> {

    private final int index;
    private final Function parent;
    private final List<Instruction> instrs = new ArrayList<>();
    private final List<BasicBlock> succs = new ArrayList<>(2);

    BasicBlock(int index, Function parent) {
        this.index = index;
        this.parent = parent;
    }

    /**
     * Append an instruction to this block
     *
     * @param i instruction to add
     */
    public void add(Instruction i) {
        i.setBlock(this);
        instrs.add(i);
    }

    public void addSuccessor(BasicBlock succ) {
        assert succ.parent == parent : "Successor " + succ + " is in a different function";
        succs.add(succ);
    }

    public int getIndex() {
        return index;
    }

    public Function getFunction() {
        return parent;
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instrs);
    }

    public List<BasicBlock> getSuccessors() {
        return Collections.unmodifiableList(succs);
    }

    /**
     * @return true if the block has no instructions, i.e. it is unreachable
     */
    public boolean isEmpty() {
        return instrs.isEmpty();
    }

    /**
     * @return last instruction of the block, or null if the block is empty
     */
    public Instruction getLastInstruction() {
        return instrs.isEmpty() ? null : instrs.get(instrs.size() - 1);
    }

    @Override
    public Iterator<Instruction> iterator() {
        return getInstructions().iterator();
    }

    @Override
    public String toString() {
        return parent.getQualifiedName() + "#" + index;
    }
}
