package analysis.nilness;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ir.BasicBlock;
import ir.Function;
import ir.Instruction;
import ir.Value;

/**
 * One activation of a function under analysis. The arguments and closure bindings are the caller's unevaluated
 * values: a parameter is evaluated in the caller's frame on first use only.
 */
public final class Frame {

    private final Function function;
    /**
     * Activation the arguments and bindings are evaluated in, null for a seed
     */
    private final Frame caller;
    /**
     * Actual arguments, null for a context-free seed
     */
    private final List<Value> args;
    /**
     * Values bound to the free variables, null unless entered through a closure call
     */
    private final List<Value> bindings;
    private final Trace trace;
    private final NilDereferenceReporter reporter;
    /**
     * Values already evaluated in this activation
     */
    private final Map<Value, AbstractState> env = new HashMap<>();
    /**
     * Blocks on the traversal path currently being walked
     */
    private final Set<BasicBlock> path = new HashSet<>();

    public Frame(Function function, Frame caller, List<Value> args, List<Value> bindings, Trace trace,
                 NilDereferenceReporter reporter) {
        assert function != null && trace != null && reporter != null;
        assert args == null || caller != null : "Arguments without a frame to evaluate them in";
        this.function = function;
        this.caller = caller;
        this.args = args;
        this.bindings = bindings;
        this.trace = trace;
        this.reporter = reporter;
    }

    public Function getFunction() {
        return function;
    }

    /**
     * @return frame of the caller, null for a seed
     */
    public Frame getCaller() {
        return caller;
    }

    public List<Value> getArgs() {
        return args;
    }

    public List<Value> getBindings() {
        return bindings;
    }

    /**
     * @return call instructions that lead to this activation, outermost first
     */
    public Trace getTrace() {
        return trace;
    }

    public NilDereferenceReporter getReporter() {
        return reporter;
    }

    /**
     * Report a dereference of a possibly nil pointer found in this activation
     *
     * @param instr faulting instruction
     */
    public void report(Instruction instr) {
        reporter.report(instr, this);
    }

    AbstractState getCached(Value v) {
        return env.get(v);
    }

    void cache(Value v, AbstractState s) {
        env.put(v, s);
    }

    /**
     * Mark a block as being on the current path
     *
     * @param bb block about to be walked
     * @return false if the block is already on the path, i.e. it was reached through a loop back edge
     */
    boolean enterBlock(BasicBlock bb) {
        return path.add(bb);
    }

    void exitBlock(BasicBlock bb) {
        path.remove(bb);
    }

    @Override
    public String toString() {
        return function.getQualifiedName() + (args == null ? "" : args.toString());
    }
}
