package analysis.nilness;

import java.util.ArrayList;
import java.util.List;

import ir.Alloc;
import ir.BasicBlock;
import ir.BinOp;
import ir.Call;
import ir.Const;
import ir.Extract;
import ir.FieldAddr;
import ir.FreeVar;
import ir.Function;
import ir.If;
import ir.Instruction;
import ir.Lookup;
import ir.Parameter;
import ir.Return;
import ir.Value;
import ir.ValueInstruction;
import types.BasicType;
import types.MapType;
import types.Type;
import util.Logger;
import util.print.PrettyPrinter;

/**
 * Symbolic evaluator computing the {@link AbstractState} of values by walking the control flow graph from a function's
 * entry block. Branches whose condition is statically decided are pruned, calls with a statically known callee are
 * evaluated by walking the callee with the call's arguments bound to its parameters, and every field access through a
 * possibly nil pointer is reported to the frame's {@link NilDereferenceReporter}.
 * <p>
 * Loads through pointers, phi nodes, globals and calls through values that are not known statically give no
 * information. A loop is walked once: reaching a block that is already on the current path gives no information.
 */
public class NilnessEvaluator {

    /**
     * Default number of times a function may be active on the call stack with the same argument shape
     */
    public static final int DEFAULT_MAX_RECURSION = 2;

    private final CallStackGuard guard;

    public NilnessEvaluator() {
        this(DEFAULT_MAX_RECURSION);
    }

    /**
     * @param maxRecursion number of times a function may be active with the same argument shape, at least 1
     */
    public NilnessEvaluator(int maxRecursion) {
        if (maxRecursion < 1) {
            throw new IllegalArgumentException("Recursion bound must be positive: " + maxRecursion);
        }
        this.guard = new CallStackGuard(maxRecursion);
    }

    /**
     * Walk a function without any knowledge of its arguments
     *
     * @param fn function to analyze
     * @param reporter receives every possible nil dereference found
     * @return state of the first result, empty if the function has no results
     */
    public AbstractState evaluateSeed(Function fn, NilDereferenceReporter reporter) {
        return evaluateFunction(null, fn, null, null, 0, null, reporter);
    }

    /**
     * Walk a callee in a new frame
     *
     * @param call call being evaluated, appended to the trace, null for a seed
     * @param fn callee
     * @param args unevaluated arguments, null for a seed
     * @param bindings unevaluated values of the callee's free variables, null unless called through a closure
     * @param res index of the result to compute
     * @param caller frame the arguments are evaluated in, null for a seed
     * @param reporter receives every possible nil dereference found
     * @return state of the requested result
     */
    AbstractState evaluateFunction(Call call, Function fn, List<Value> args, List<Value> bindings, int res,
                                   Frame caller, NilDereferenceReporter reporter) {
        if (fn.isExternal()) {
            Logger.println(3, "EXTERNAL: " + fn.getQualifiedName());
            return AbstractState.EMPTY;
        }
        if (!guard.enter(fn, args)) {
            Logger.println(1, "RECURSION BOUND: not entering " + fn.getQualifiedName() + " again");
            return AbstractState.EMPTY;
        }
        try {
            Trace trace = caller == null ? Trace.EMPTY : caller.getTrace();
            if (call != null) {
                trace = trace.append(call);
            }
            Frame callee = new Frame(fn, caller, args, bindings, trace, reporter);
            return evaluateBlock(fn.getEntryBlock(), callee, res);
        }
        finally {
            guard.exit(fn, args);
        }
    }

    /**
     * State of a value, reusing the state computed earlier in the same frame if there is one
     *
     * @param v value
     * @param fr frame the value is evaluated in
     * @return abstract state
     */
    public AbstractState lookup(Value v, Frame fr) {
        AbstractState s = fr.getCached(v);
        if (s != null) {
            return s;
        }
        return evaluate(v, fr);
    }

    /**
     * Compute the state of a value and record it in the frame. Reports are made every time a field address is
     * evaluated.
     *
     * @param v value
     * @param fr frame the value is evaluated in
     * @return abstract state
     */
    public AbstractState evaluate(Value v, Frame fr) {
        AbstractState s = transfer(v, fr);
        fr.cache(v, s);
        if (v instanceof Instruction) {
            Logger.println(2, "\t" + PrettyPrinter.instructionString((Instruction) v) + " : " + s);
        }
        return s;
    }

    private AbstractState transfer(Value v, Frame fr) {
        if (v instanceof Const) {
            return flowConst((Const) v);
        }
        if (v instanceof Parameter) {
            return flowParameter((Parameter) v, fr);
        }
        if (v instanceof FreeVar) {
            return flowFreeVar((FreeVar) v, fr);
        }
        if (!(v instanceof ValueInstruction)) {
            // globals and functions
            return AbstractState.EMPTY;
        }
        ValueInstruction i = (ValueInstruction) v;
        switch (i.getInstructionType()) {
        case ALLOC:
            return flowAlloc((Alloc) i);
        case BINARY_OP:
            return flowBinaryOp((BinOp) i, fr);
        case CALL:
            return evaluateCall((Call) i, fr, 0);
        case EXTRACT:
            return flowExtract((Extract) i, fr);
        case FIELD_ADDR:
            return flowFieldAddr((FieldAddr) i, fr);
        case LOOKUP:
            return flowLookup((Lookup) i, fr);
        case UNARY_OP:
            // loads through pointers are not modeled
        case MAKE_CLOSURE:
        case PHI:
        case OPAQUE_VALUE:
            return AbstractState.EMPTY;
        default:
            throw new IllegalStateException("Unexpected value instruction " + PrettyPrinter.instructionString(i));
        }
    }

    private static AbstractState flowConst(Const c) {
        return AbstractState.of(new Alternative(c, c.isZero(), false));
    }

    private static AbstractState flowAlloc(Alloc a) {
        return AbstractState.of(new Alternative(a, false, a.getAllocatedType().isReferenceLike()));
    }

    private AbstractState flowParameter(Parameter p, Frame fr) {
        List<Value> args = fr.getArgs();
        if (args == null) {
            return AbstractState.EMPTY;
        }
        int i = fr.getFunction().getParams().indexOf(p);
        if (i < 0 || i >= args.size()) {
            return AbstractState.EMPTY;
        }
        return lookup(args.get(i), fr.getCaller());
    }

    private AbstractState flowFreeVar(FreeVar fv, Frame fr) {
        List<Value> bindings = fr.getBindings();
        if (bindings == null) {
            return AbstractState.EMPTY;
        }
        int i = fr.getFunction().getFreeVars().indexOf(fv);
        if (i < 0 || i >= bindings.size()) {
            return AbstractState.EMPTY;
        }
        return lookup(bindings.get(i), fr.getCaller());
    }

    private AbstractState flowBinaryOp(BinOp op, Frame fr) {
        AbstractState xs = lookup(op.getX(), fr);
        AbstractState ys = lookup(op.getY(), fr);
        if (xs.isEmpty() || ys.isEmpty()) {
            return AbstractState.EMPTY;
        }
        AbstractState.Builder b = new AbstractState.Builder();
        if (xs.size() == ys.size()) {
            for (int i = 0; i < xs.size(); i++) {
                combine(op, xs.get(i), ys.get(i), b);
            }
        }
        else {
            for (Alternative x : xs) {
                for (Alternative y : ys) {
                    combine(op, x, y, b);
                }
            }
        }
        return b.build();
    }

    /**
     * Alternatives of the result of a binary operation for one pair of operand alternatives
     */
    private static void combine(BinOp op, Alternative x, Alternative y, AbstractState.Builder b) {
        Value c = new Placeholder(op.getType());
        switch (op.getOperator()) {
        case ADD:
        case SUB:
        case AND:
        case OR:
        case XOR:
        case AND_NOT:
            arithmetic(c, x.isZero() && y.isZero(), b);
            break;
        case MUL:
            arithmetic(c, x.isZero() || y.isZero(), b);
            break;
        case QUO:
        case REM:
        case SHL:
        case SHR:
            arithmetic(c, x.isZero(), b);
            break;
        case EQL:
        case LEQ:
        case GEQ:
            equality(c, x, y, true, b);
            break;
        case NEQ:
            equality(c, x, y, false, b);
            break;
        case LSS:
        case GTR:
            b.add(Alternative.zero(c));
            b.add(Alternative.nonZero(c));
            break;
        default:
            throw new IllegalStateException("Unknown operator " + op.getOperator());
        }
    }

    /**
     * The result may always be zero, it is non-zero unless it is guaranteed to be zero
     */
    private static void arithmetic(Value c, boolean guaranteedZero, AbstractState.Builder b) {
        if (!guaranteedZero) {
            b.add(Alternative.nonZero(c));
        }
        b.add(Alternative.zero(c));
    }

    /**
     * Two zero operands are equal, a zero and a non-zero operand are not, two non-zero operands may be either
     */
    private static void equality(Value c, Alternative x, Alternative y, boolean whenEqual, AbstractState.Builder b) {
        if (x.isZero() && y.isZero()) {
            b.add(new Alternative(c, !whenEqual, false));
        }
        else if (x.isZero() != y.isZero()) {
            b.add(new Alternative(c, whenEqual, false));
        }
        else {
            b.add(Alternative.zero(c));
            b.add(Alternative.nonZero(c));
        }
    }

    private AbstractState flowExtract(Extract e, Frame fr) {
        Value t = e.getTuple();
        if (t instanceof Call) {
            return evaluateCall((Call) t, fr, e.getIndex());
        }
        if (t instanceof Lookup && ((Lookup) t).isCommaOk()) {
            Lookup l = (Lookup) t;
            Type mt = l.getX().getType().getUnderlying();
            if (!(mt instanceof MapType)) {
                return AbstractState.EMPTY;
            }
            Type resultType = e.getIndex() == 0 ? ((MapType) mt).getElem() : BasicType.BOOL;
            return mapLookup(l, resultType, fr);
        }
        return AbstractState.EMPTY;
    }

    private AbstractState flowLookup(Lookup l, Frame fr) {
        if (l.isCommaOk()) {
            // tuple valued, only its components are evaluated
            return AbstractState.EMPTY;
        }
        Type mt = l.getX().getType().getUnderlying();
        if (!(mt instanceof MapType)) {
            return AbstractState.EMPTY;
        }
        return mapLookup(l, ((MapType) mt).getElem(), fr);
    }

    /**
     * A lookup may always miss. It can only hit if the map is not nil.
     */
    private AbstractState mapLookup(Lookup l, Type resultType, Frame fr) {
        AbstractState xs = lookup(l.getX(), fr);
        AbstractState.Builder b = new AbstractState.Builder();
        for (Alternative x : xs) {
            Value c = new Placeholder(resultType);
            b.add(Alternative.zero(c));
            if (!x.isZero()) {
                b.add(Alternative.nonZero(c));
            }
        }
        return b.build();
    }

    private AbstractState flowFieldAddr(FieldAddr fa, Frame fr) {
        Value x = fa.getX();
        if (x instanceof Const && x.getType().isPointer()) {
            fr.report(fa);
            return AbstractState.EMPTY;
        }
        AbstractState xs = lookup(x, fr);
        AbstractState.Builder b = new AbstractState.Builder();
        for (Alternative a : xs) {
            if (a.isZero()) {
                fr.report(fa);
                continue;
            }
            Value field = new Placeholder(fa.getType());
            b.add(new Alternative(field, false, true));
            if (!a.isPointeeZero()) {
                b.add(new Alternative(field, false, false));
            }
        }
        return b.build();
    }

    /**
     * Evaluate a call, by walking the callee if it is known statically
     *
     * @param call call instruction
     * @param fr frame of the caller
     * @param res index of the result to compute
     * @return state of the result
     */
    private AbstractState evaluateCall(Call call, Frame fr, int res) {
        switch (call.getMode()) {
        case STATIC:
        case CLOSURE:
            return evaluateFunction(call, call.getStaticCallee(), call.getArgs(), call.getBindings(), res, fr,
                                    fr.getReporter());
        case INVOKE:
        case FUNCTION_VALUE:
            return AbstractState.EMPTY;
        default:
            throw new IllegalStateException("Unknown call mode " + call.getMode());
        }
    }

    /**
     * Walk a block and the blocks reachable from it
     *
     * @param bb block to walk
     * @param fr current frame
     * @param res index of the result returned by the function that is of interest
     * @return union of the states of the result at every return reached
     */
    AbstractState evaluateBlock(BasicBlock bb, Frame fr, int res) {
        if (bb.isEmpty()) {
            return AbstractState.EMPTY;
        }
        if (!fr.enterBlock(bb)) {
            Logger.println(3, "BACK EDGE: " + bb);
            return AbstractState.EMPTY;
        }
        try {
            Logger.println(3, "BLOCK: " + bb);
            for (Instruction i : bb) {
                switch (i.getInstructionType()) {
                case FIELD_ADDR:
                    evaluate((FieldAddr) i, fr);
                    break;
                case CALL:
                    Call call = (Call) i;
                    Function callee = call.getStaticCallee();
                    if (callee != null) {
                        evaluateFunction(call, callee, call.getArgs(), call.getBindings(), 0, fr, fr.getReporter());
                    }
                    break;
                default:
                    break;
                }
            }

            Instruction last = bb.getLastInstruction();
            switch (last.getInstructionType()) {
            case IF:
                return flowIf((If) last, bb, fr, res);
            case JUMP:
                return evaluateBlock(bb.getSuccessors().get(0), fr, res);
            case PANIC:
                return AbstractState.EMPTY;
            case RETURN:
                List<Value> results = ((Return) last).getResults();
                if (results.isEmpty()) {
                    return AbstractState.EMPTY;
                }
                return lookup(results.get(res), fr);
            default:
                throw new IllegalStateException("Block " + bb + " does not end in a terminator: "
                        + PrettyPrinter.instructionString(last));
            }
        }
        finally {
            fr.exitBlock(bb);
        }
    }

    /**
     * Walk the successors of a conditional branch that the state of the condition does not rule out
     */
    private AbstractState flowIf(If i, BasicBlock bb, Frame fr, int res) {
        AbstractState cond = lookup(i.getCond(), fr);
        if (cond.isEmpty()) {
            return AbstractState.EMPTY;
        }
        List<AbstractState> states = new ArrayList<>(2);
        if (cond.mayBeNonZero()) {
            states.add(evaluateBlock(bb.getSuccessors().get(0), fr, res));
        }
        if (cond.mayBeZero()) {
            states.add(evaluateBlock(bb.getSuccessors().get(1), fr, res));
        }
        AbstractState.Builder b = new AbstractState.Builder();
        for (AbstractState s : states) {
            b.addAll(s);
        }
        return b.build();
    }

    /**
     * @return true if no call is being evaluated
     */
    boolean isIdle() {
        return guard.isIdle();
    }
}
