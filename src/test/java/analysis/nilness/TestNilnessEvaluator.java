package analysis.nilness;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ir.Alloc;
import ir.BasicBlock;
import ir.BinOp;
import ir.BinaryOperator;
import ir.Call;
import ir.Const;
import ir.Extract;
import ir.FieldAddr;
import ir.FreeVar;
import ir.Function;
import ir.Global;
import ir.If;
import ir.Instruction;
import ir.InstructionType;
import ir.Jump;
import ir.MakeClosure;
import ir.Panic;
import ir.Parameter;
import ir.Return;
import ir.Value;
import junit.framework.TestCase;
import types.BasicType;
import types.InterfaceType;
import types.NamedType;
import types.PointerType;
import types.SignatureType;
import types.TupleType;
import types.Type;
import types.TypeRepository;

/**
 * Walking function bodies: branch pruning, loops, calls and recursion
 */
public class TestNilnessEvaluator extends TestCase {

    private PointerType ptrA;
    private Type ptrInt;
    private NilnessResults results;

    @Override
    protected void setUp() throws Exception {
        TypeRepository types = new TypeRepository();
        types.declare("pkg", "A");
        types.define("pkg", "A", "struct{X int; a *A}");
        ptrA = (PointerType) types.parse("*A", "pkg");
        ptrInt = types.parse("*int", "pkg");
        results = new NilnessResults();
    }

    private static Function function(String name, List<Type> params, List<Type> res) {
        return new Function("pkg", name, new SignatureType(new TupleType(params), new TupleType(res)));
    }

    private Function function(String name) {
        return function(name, Collections.<Type> emptyList(), Collections.<Type> emptyList());
    }

    private static BasicBlock block(Function f, Instruction... instrs) {
        BasicBlock bb = f.newBlock();
        for (Instruction i : instrs) {
            bb.add(i);
        }
        return bb;
    }

    private static void edges(BasicBlock from, BasicBlock... to) {
        for (BasicBlock bb : to) {
            from.addSuccessor(bb);
        }
    }

    private static Return ret(Value... vals) {
        return new Return(Arrays.asList(vals));
    }

    private Const nil() {
        return Const.nil(ptrA);
    }

    private FieldAddr fieldX(String name, Value base) {
        return new FieldAddr(name, ptrInt, base, 0);
    }

    private static List<Boolean> zeros(AbstractState s) {
        Boolean[] z = new Boolean[s.size()];
        for (int i = 0; i < s.size(); i++) {
            z[i] = s.get(i).isZero();
        }
        return Arrays.asList(z);
    }

    /**
     * func f() *A { if cond { return new(A) }; return nil }
     */
    private Function conditionalNil(String name, Value cond) {
        Function f = function(name, Collections.<Type> emptyList(), Collections.<Type> singletonList(ptrA));
        BasicBlock b0 = block(f, new If(cond));
        Alloc a = new Alloc("t1", ptrA, true);
        BasicBlock b1 = block(f, a, ret(a));
        BasicBlock b2 = block(f, ret(nil()));
        edges(b0, b1, b2);
        return f;
    }

    public void testStaticallyTrueBranch() {
        Function f = function("f", Collections.<Type> emptyList(), Collections.<Type> singletonList(ptrA));
        BinOp cond = new BinOp("t0", BasicType.BOOL, BinaryOperator.EQL, nil(), nil());
        BasicBlock b0 = block(f, cond, new If(cond));
        Alloc a = new Alloc("t1", ptrA, true);
        BasicBlock b1 = block(f, a, ret(a));
        BasicBlock b2 = block(f, ret(nil()));
        edges(b0, b1, b2);

        AbstractState s = new NilnessEvaluator().evaluateSeed(f, results);
        assertEquals(Arrays.asList(false), zeros(s));
        assertSame(a, s.get(0).getValue());
    }

    public void testUnknownConditionGivesNoInformation() {
        Function f = function("f", Collections.<Type> singletonList(BasicType.BOOL),
                              Collections.<Type> singletonList(ptrA));
        Parameter ok = f.addParameter("ok", BasicType.BOOL);
        BasicBlock b0 = block(f, new If(ok));
        BasicBlock b1 = block(f, ret(nil()));
        BasicBlock b2 = block(f, ret(nil()));
        edges(b0, b1, b2);
        assertTrue(new NilnessEvaluator().evaluateSeed(f, results).isEmpty());
    }

    public void testBothBranchesTrueFirst() {
        Const one = Const.number(BigDecimal.ONE, BasicType.INT);
        // the comparison is not in any block, it is evaluated on demand
        Function f = conditionalNil("f", new BinOp("t0", BasicType.BOOL, BinaryOperator.LSS, one, one));
        AbstractState s = new NilnessEvaluator().evaluateSeed(f, results);
        assertEquals(Arrays.asList(false, true), zeros(s));
    }

    public void testInfeasibleBranchIsNotWalked() {
        Function f = function("f");
        BinOp cond = new BinOp("t0", BasicType.BOOL, BinaryOperator.NEQ, nil(), nil());
        BasicBlock b0 = block(f, cond, new If(cond));
        BasicBlock b1 = block(f, fieldX("t1", nil()), ret());
        BasicBlock b2 = block(f, ret());
        edges(b0, b1, b2);
        new NilnessEvaluator().evaluateSeed(f, results);
        assertTrue(results.isEmpty());
    }

    public void testTerminators() {
        Function empty = function("empty");
        BasicBlock b0 = block(empty, new Jump());
        BasicBlock b1 = block(empty);
        edges(b0, b1);
        assertTrue(new NilnessEvaluator().evaluateSeed(empty, results).isEmpty());

        Function panics = function("panics", Collections.<Type> emptyList(), Collections.<Type> singletonList(ptrA));
        block(panics, new Panic(Const.string("boom", BasicType.STRING)));
        assertTrue(new NilnessEvaluator().evaluateSeed(panics, results).isEmpty());

        Function noResults = function("noResults");
        block(noResults, fieldX("t0", nil()), ret());
        assertTrue(new NilnessEvaluator().evaluateSeed(noResults, results).isEmpty());
        assertEquals(1, results.size());
    }

    public void testMissingTerminator() {
        Function f = function("f");
        block(f, new Alloc("t0", ptrA, true));
        try {
            new NilnessEvaluator().evaluateSeed(f, results);
            fail("Block without terminator was walked");
        }
        catch (IllegalStateException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("pkg.f#0"));
        }
    }

    public void testLoopIsWalkedOnce() {
        Function f = function("f");
        BasicBlock b0 = block(f, new Jump());
        BasicBlock b1 = block(f, fieldX("t0", nil()), new Jump());
        edges(b0, b1);
        edges(b1, b1);
        NilnessEvaluator evaluator = new NilnessEvaluator();
        assertTrue(evaluator.evaluateSeed(f, results).isEmpty());
        assertEquals(1, results.size());
        assertTrue(evaluator.isIdle());
    }

    public void testNilArgumentIsReportedWithCallSite() {
        Function g = function("g", Collections.<Type> singletonList(ptrA), Collections.<Type> emptyList());
        Parameter a = g.addParameter("a", ptrA);
        FieldAddr deref = fieldX("t0", a);
        block(g, deref, ret());

        Function f = function("f");
        Call call = Call.call("t0", TupleType.EMPTY, g, Collections.<Value> singletonList(nil()));
        block(f, call, ret());

        NilnessEvaluator evaluator = new NilnessEvaluator();
        evaluator.evaluateSeed(g, results);
        assertTrue(results.isEmpty());
        evaluator.evaluateSeed(f, results);
        assertEquals(1, results.size());
        assertEquals(Arrays.<Instruction> asList(call, deref), results.getTraces().get(0).getInstructions());
    }

    public void testGlobalArgumentGivesNoInformation() {
        Function g = function("g", Collections.<Type> singletonList(ptrA), Collections.<Type> emptyList());
        Parameter a = g.addParameter("a", ptrA);
        block(g, fieldX("t0", a), ret());

        // var global A
        Global global = new Global("pkg", "global", ptrA.getElem());
        assertEquals(ptrA, global.getType());
        Function f = function("f");
        block(f, Call.call("t0", TupleType.EMPTY, g, Collections.<Value> singletonList(global)), ret());

        NilnessEvaluator evaluator = new NilnessEvaluator();
        assertTrue(evaluator.lookup(global, new Frame(f, null, null, null, Trace.EMPTY, results)).isEmpty());
        evaluator.evaluateSeed(f, results);
        assertTrue(results.isEmpty());
    }

    public void testReturnedNilIsReportedInCaller() {
        Function mayBeNil = conditionalNil("mayBeNil", Const.bool(false));
        Function f = function("f");
        Call call = Call.call("t0", ptrA, mayBeNil, Collections.<Value> emptyList());
        FieldAddr deref = fieldX("t1", call);
        block(f, call, deref, ret());
        new NilnessEvaluator().evaluateSeed(f, results);
        assertEquals(1, results.size());
        assertEquals(Collections.<Instruction> singletonList(deref), results.getTraces().get(0).getInstructions());
    }

    public void testCheckedResultIsNotReported() {
        Function mayBeNil = conditionalNil("mayBeNil", Const.bool(false));
        Function f = function("f");
        Call call = Call.call("t0", ptrA, mayBeNil, Collections.<Value> emptyList());
        BinOp isNil = new BinOp("t1", BasicType.BOOL, BinaryOperator.EQL, call, nil());
        BasicBlock b0 = block(f, call, isNil, new If(isNil));
        BasicBlock b1 = block(f, ret());
        BasicBlock b2 = block(f, fieldX("t2", call), ret());
        edges(b0, b1, b2);
        new NilnessEvaluator().evaluateSeed(f, results);
        assertTrue(results.isEmpty());
    }

    public void testMultipleResults() {
        Function two = function("two", Collections.<Type> emptyList(), Arrays.<Type> asList(ptrA, ptrA));
        Alloc a = new Alloc("t0", ptrA, true);
        block(two, a, ret(nil(), a));

        Function f = function("f");
        Call call = Call.call("t0", two.getSignature().getCallType(), two, Collections.<Value> emptyList());
        Extract first = new Extract("t1", ptrA, call, 0);
        Extract second = new Extract("t2", ptrA, call, 1);
        FieldAddr bad = fieldX("t3", first);
        FieldAddr good = fieldX("t4", second);
        block(f, call, first, second, bad, good, ret());
        new NilnessEvaluator().evaluateSeed(f, results);
        assertEquals(1, results.size());
        assertSame(bad, results.getTraces().get(0).getLast());
    }

    public void testClosureBindings() {
        Function inner = function("f$1");
        FreeVar fv = inner.addFreeVar("a", ptrA);
        FieldAddr deref = fieldX("t0", fv);
        block(inner, deref, ret());

        Function outer = function("f");
        MakeClosure mc = new MakeClosure("t0", inner.getType(), inner, Collections.<Value> singletonList(nil()));
        Call call = Call.call("t1", TupleType.EMPTY, mc, Collections.<Value> emptyList());
        block(outer, mc, call, ret());

        NilnessEvaluator evaluator = new NilnessEvaluator();
        evaluator.evaluateSeed(inner, results);
        assertTrue(results.isEmpty());
        evaluator.evaluateSeed(outer, results);
        assertEquals(1, results.size());
        assertEquals(Arrays.<Instruction> asList(call, deref), results.getTraces().get(0).getInstructions());
    }

    public void testDynamicCallsAreNotFollowed() {
        Function g = function("g", Collections.<Type> singletonList(ptrA), Collections.<Type> emptyList());
        Parameter a = g.addParameter("a", ptrA);
        block(g, fieldX("t0", a), ret());

        Function f = function("f", Collections.<Type> singletonList(g.getType()), Collections.<Type> emptyList());
        Parameter fnValue = f.addParameter("fn", g.getType());
        Type iface = new NamedType("pkg.I", new InterfaceType("M(*A)"));
        Value recv = Const.nil(iface);
        Call viaValue = Call.call("t0", TupleType.EMPTY, fnValue, Collections.<Value> singletonList(nil()));
        Call invoke = Call.invoke("t1", TupleType.EMPTY, recv, "M", Collections.<Value> singletonList(nil()));
        block(f, viaValue, invoke, ret());
        new NilnessEvaluator().evaluateSeed(f, results);
        assertTrue(results.isEmpty());
        assertEquals(Call.Mode.FUNCTION_VALUE, viaValue.getMode());
        assertNull(invoke.getStaticCallee());
    }

    public void testExternalCalleeGivesNoInformation() {
        Function ext = function("ext", Collections.<Type> emptyList(), Collections.<Type> singletonList(ptrA));
        Function f = function("f");
        Call call = Call.call("t0", ptrA, ext, Collections.<Value> emptyList());
        block(f, call, fieldX("t1", call), ret());
        new NilnessEvaluator().evaluateSeed(f, results);
        assertTrue(results.isEmpty());
    }

    /**
     * func r(p *A) { r(nil); _ = p.X }
     */
    private Function recursive() {
        Function r = function("r", Collections.<Type> singletonList(ptrA), Collections.<Type> emptyList());
        Parameter p = r.addParameter("p", ptrA);
        block(r, Call.call("t0", TupleType.EMPTY, r, Collections.<Value> singletonList(nil())), fieldX("t1", p),
              ret());
        return r;
    }

    public void testRecursionIsBounded() {
        NilnessEvaluator evaluator = new NilnessEvaluator(2);
        evaluator.evaluateSeed(recursive(), results);
        assertTrue(evaluator.isIdle());
        // the seed knows nothing about p, the two nested activations are entered with nil
        assertEquals(2, results.size());
        assertEquals(3, results.getTraces().get(0).size());
        assertEquals(2, results.getTraces().get(1).size());

        NilnessResults once = new NilnessResults();
        new NilnessEvaluator(1).evaluateSeed(recursive(), once);
        assertEquals(1, once.size());
    }

    public void testParameterPassedThroughRecursion() {
        // func r(p *A) { r(p); _ = p.X }
        Function r = function("r", Collections.<Type> singletonList(ptrA), Collections.<Type> emptyList());
        Parameter p = r.addParameter("p", ptrA);
        block(r, Call.call("t0", TupleType.EMPTY, r, Collections.<Value> singletonList(p)), fieldX("t1", p), ret());
        // func f() { r(nil) }
        Function f = function("f");
        block(f, Call.call("t0", TupleType.EMPTY, r, Collections.<Value> singletonList(nil())), ret());

        NilnessEvaluator evaluator = new NilnessEvaluator();
        evaluator.evaluateSeed(r, results);
        assertTrue(results.isEmpty());
        evaluator.evaluateSeed(f, results);
        // the nil argument flows through every activation below the bound
        assertFalse(results.isEmpty());
        for (Trace t : results.getTraces()) {
            assertEquals(InstructionType.FIELD_ADDR, t.getLast().getInstructionType());
        }
        assertTrue(evaluator.isIdle());
    }

    public void testRecursionBoundMustBePositive() {
        try {
            new NilnessEvaluator(0);
            fail("Accepted a recursion bound of zero");
        }
        catch (IllegalArgumentException e) {
            // expected
        }
    }
}
