package analysis.nilness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.ibm.wala.util.collections.Pair;

import ir.Const;
import ir.FreeVar;
import ir.Function;
import ir.Global;
import ir.Instruction;
import ir.Parameter;
import ir.Value;

/**
 * Bounds how often a function may be active on the analysis call stack with arguments of the same shape. Recursion
 * would otherwise unfold forever since calls are evaluated by walking the callee's body.
 */
final class CallStackGuard {

    private final int maxRecursion;
    /**
     * Number of activations currently on the stack for each (function, argument shape)
     */
    private final Map<Pair<Function, List<String>>, Integer> active = new HashMap<>();

    CallStackGuard(int maxRecursion) {
        assert maxRecursion > 0;
        this.maxRecursion = maxRecursion;
    }

    /**
     * Record entry into a function
     *
     * @param fn callee
     * @param args unevaluated arguments, null for a seed
     * @return false if the function is already active the maximum number of times with this argument shape, in that
     *         case nothing is recorded
     */
    boolean enter(Function fn, List<Value> args) {
        Pair<Function, List<String>> key = Pair.make(fn, shape(args));
        Integer count = active.get(key);
        int n = count == null ? 0 : count;
        if (n >= maxRecursion) {
            return false;
        }
        active.put(key, n + 1);
        return true;
    }

    /**
     * Record return from a function previously entered with {@link #enter(Function, List)}
     */
    void exit(Function fn, List<Value> args) {
        Pair<Function, List<String>> key = Pair.make(fn, shape(args));
        Integer count = active.get(key);
        assert count != null && count > 0 : "Exit without entry for " + fn;
        if (count == 1) {
            active.remove(key);
        }
        else {
            active.put(key, count - 1);
        }
    }

    /**
     * @return true if no function is active
     */
    boolean isIdle() {
        return active.isEmpty();
    }

    /**
     * Coarse description of the arguments: constants by whether they are zero, everything else by the kind of value
     */
    static List<String> shape(List<Value> args) {
        if (args == null) {
            return Collections.singletonList("<seed>");
        }
        List<String> s = new ArrayList<>(args.size());
        for (Value v : args) {
            if (v instanceof Const) {
                s.add(((Const) v).isZero() ? "zero" : "non-zero");
            }
            else if (v instanceof Instruction) {
                s.add(((Instruction) v).getInstructionType().toString());
            }
            else if (v instanceof Parameter) {
                s.add("param");
            }
            else if (v instanceof FreeVar) {
                s.add("freevar");
            }
            else if (v instanceof Global) {
                s.add("global");
            }
            else if (v instanceof Function) {
                s.add("func");
            }
            else {
                s.add("value");
            }
        }
        return s;
    }
}
