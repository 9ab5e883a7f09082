package analysis.nilness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import ir.Instruction;

/**
 * Call path evidence for a nil dereference: the call instructions from the outermost analyzed function down to the
 * faulting instruction, which is last. Immutable.
 */
public final class Trace implements Iterable<Instruction> {

    public static final Trace EMPTY = new Trace(Collections.<Instruction> emptyList());

    private final List<Instruction> instrs;

    private Trace(List<Instruction> instrs) {
        this.instrs = instrs;
    }

    /**
     * New trace with the given instruction appended
     *
     * @param i call site or fault site
     * @return extended trace, this trace is unchanged
     */
    public Trace append(Instruction i) {
        List<Instruction> l = new ArrayList<>(instrs.size() + 1);
        l.addAll(instrs);
        l.add(i);
        return new Trace(Collections.unmodifiableList(l));
    }

    public int size() {
        return instrs.size();
    }

    public Instruction get(int i) {
        return instrs.get(i);
    }

    public List<Instruction> getInstructions() {
        return instrs;
    }

    /**
     * @return last instruction, for a reported trace the faulting instruction
     */
    public Instruction getLast() {
        return instrs.isEmpty() ? null : instrs.get(instrs.size() - 1);
    }

    @Override
    public Iterator<Instruction> iterator() {
        return instrs.iterator();
    }

    @Override
    public int hashCode() {
        return instrs.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Trace && instrs.equals(((Trace) obj).instrs);
    }

    @Override
    public String toString() {
        return instrs.toString();
    }
}
