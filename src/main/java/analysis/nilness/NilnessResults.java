package analysis.nilness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ir.Instruction;

/**
 * Collects the trace of every possible nil dereference found, in discovery order. The same fault reached along
 * different paths is recorded once per path.
 */
public class NilnessResults implements NilDereferenceReporter {

    private final List<Trace> traces = new ArrayList<>();

    @Override
    public void report(Instruction instr, Frame frame) {
        traces.add(frame.getTrace().append(instr));
    }

    public List<Trace> getTraces() {
        return Collections.unmodifiableList(traces);
    }

    public boolean isEmpty() {
        return traces.isEmpty();
    }

    public int size() {
        return traces.size();
    }
}
