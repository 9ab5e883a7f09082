package analysis.nilness;

import java.io.PrintStream;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import ir.Instruction;
import ir.SourcePosition;
import util.serialization.JSONSerializable;

/**
 * Traces of possible nil dereferences resolved to source positions. Each trace lists the calls leading to the fault
 * and then the faulting field access.
 */
public class NilnessReport implements JSONSerializable {

    /**
     * Message printed after the position of every step
     */
    public static final String MESSAGE = "possible nil pointer dereference";

    /**
     * One element of a trace in source terms
     */
    public static final class Step {
        private final SourcePosition position;
        private final String source;

        public Step(SourcePosition position, String source) {
            this.position = position;
            this.source = source;
        }

        public SourcePosition getPosition() {
            return position;
        }

        public String getSource() {
            return source;
        }

        JSONObject toJSON() {
            JSONObject o = new JSONObject();
            o.put("file", position.getFile());
            o.put("line", position.getLine());
            o.put("column", position.getColumn());
            o.put("src", source);
            return o;
        }

        @Override
        public String toString() {
            return position + ": " + MESSAGE + ": " + source;
        }
    }

    private final List<List<Step>> traces;

    public NilnessReport(List<List<Step>> traces) {
        this.traces = Collections.unmodifiableList(traces);
    }

    /**
     * Resolve the traces of an analysis run
     *
     * @param results traces found
     * @param locator maps instructions to source
     * @return report with one entry per trace, in the order they were found
     */
    public static NilnessReport create(NilnessResults results, SourceLocator locator) {
        List<List<Step>> traces = new ArrayList<>(results.size());
        for (Trace t : results.getTraces()) {
            List<Step> steps = new ArrayList<>(t.size());
            for (Instruction i : t) {
                steps.add(new Step(locator.getPosition(i), locator.getSource(i)));
            }
            traces.add(Collections.unmodifiableList(steps));
        }
        return new NilnessReport(traces);
    }

    public List<List<Step>> getTraces() {
        return traces;
    }

    public boolean isEmpty() {
        return traces.isEmpty();
    }

    /**
     * Print every trace, one step per line, steps after the first indented by a tab
     *
     * @param out stream to print to
     */
    public void print(PrintStream out) {
        for (List<Step> trace : traces) {
            boolean first = true;
            for (Step s : trace) {
                out.println((first ? "" : "\t") + s);
                first = false;
            }
        }
    }

    @Override
    public JSONObject toJSON() {
        JSONArray ts = new JSONArray();
        for (List<Step> trace : traces) {
            JSONArray steps = new JSONArray();
            for (Step s : trace) {
                steps.put(s.toJSON());
            }
            ts.put(steps);
        }
        JSONObject o = new JSONObject();
        o.put("message", MESSAGE);
        o.put("traces", ts);
        return o;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out, 2, 0);
    }
}
