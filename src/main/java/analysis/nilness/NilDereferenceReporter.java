package analysis.nilness;

import ir.Instruction;

/**
 * Receives every confirmed unsafe dereference at the moment it is found during evaluation
 */
public interface NilDereferenceReporter {

    /**
     * Record a possible nil dereference
     *
     * @param instr instruction dereferencing a possibly nil pointer
     * @param frame activation in which it was found, carrying the call trace that leads there
     */
    void report(Instruction instr, Frame frame);
}
