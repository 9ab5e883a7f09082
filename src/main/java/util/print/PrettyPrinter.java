package util.print;

import java.util.Iterator;
import java.util.List;

import ir.Alloc;
import ir.BasicBlock;
import ir.BinOp;
import ir.Call;
import ir.Extract;
import ir.FieldAddr;
import ir.Function;
import ir.Global;
import ir.Instruction;
import ir.Lookup;
import ir.MakeClosure;
import ir.OpaqueInstruction;
import ir.OpaqueValue;
import ir.Parameter;
import ir.UnOp;
import ir.Value;
import ir.ValueInstruction;
import types.TupleType;

/**
 * Pretty printer for the control flow graph. Instructions are printed in SSA form, e.g. "t2 = &amp;t1.X [#0]".
 */
public class PrettyPrinter {

    private PrettyPrinter() {
        // static methods only
    }

    /**
     * String for a value used as an operand
     *
     * @param v value
     * @return name of the value, constants are printed with their type
     */
    public static String valString(Value v) {
        if (v == null) {
            return "null";
        }
        if (v instanceof Function) {
            return ((Function) v).getQualifiedName();
        }
        if (v instanceof Global) {
            return ((Global) v).getQualifiedName();
        }
        return v.getName();
    }

    /**
     * Comma separated operands
     */
    private static String valStrings(List<? extends Value> vals) {
        StringBuilder sb = new StringBuilder();
        Iterator<? extends Value> iter = vals.iterator();
        while (iter.hasNext()) {
            sb.append(valString(iter.next()));
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.toString();
    }

    /**
     * Print an instruction in SSA form
     *
     * @param i instruction to print
     * @return string for the instruction
     */
    public static String instructionString(Instruction i) {
        String rhs = rightHandSide(i);
        if (i instanceof ValueInstruction) {
            return ((ValueInstruction) i).getName() + " = " + rhs;
        }
        return rhs;
    }

    private static String rightHandSide(Instruction i) {
        switch (i.getInstructionType()) {
        case ALLOC:
            Alloc alloc = (Alloc) i;
            return (alloc.isHeap() ? "new " : "local ") + alloc.getAllocatedType();
        case BINARY_OP:
            BinOp binop = (BinOp) i;
            return valString(binop.getX()) + " " + binop.getOperator() + " " + valString(binop.getY());
        case UNARY_OP:
            UnOp unop = (UnOp) i;
            return unop.getOperator() + valString(unop.getX()) + (unop.isCommaOk() ? ",ok" : "");
        case CALL:
            Call call = (Call) i;
            if (call.isInvoke()) {
                return "invoke " + valString(call.getReceiver()) + "." + call.getMethod() + "("
                        + valStrings(call.getArgs()) + ")";
            }
            return valString(call.getFunctionValue()) + "(" + valStrings(call.getArgs()) + ")";
        case MAKE_CLOSURE:
            MakeClosure mc = (MakeClosure) i;
            return "make closure " + valString(mc.getFunction()) + " [" + valStrings(mc.getBindings()) + "]";
        case EXTRACT:
            Extract ex = (Extract) i;
            return "extract " + valString(ex.getTuple()) + " #" + ex.getIndex();
        case FIELD_ADDR:
            FieldAddr fa = (FieldAddr) i;
            return "&" + valString(fa.getX()) + "." + fa.getFieldName() + " [#" + fa.getFieldIndex() + "]";
        case LOOKUP:
            Lookup lookup = (Lookup) i;
            return valString(lookup.getX()) + "[" + valString(lookup.getIndex()) + "]"
                    + (lookup.isCommaOk() ? ",ok" : "");
        case PHI:
            return "phi [" + valStrings(i.getOperands()) + "]";
        case OPAQUE_VALUE:
            return ((OpaqueValue) i).getOp() + " " + valStrings(i.getOperands());
        case OPAQUE_EFFECT:
            return ((OpaqueInstruction) i).getOp() + " " + valStrings(i.getOperands());
        case IF:
            List<BasicBlock> succs = i.getBlock() == null ? null : i.getBlock().getSuccessors();
            if (succs == null || succs.size() != 2) {
                return "if " + valStrings(i.getOperands());
            }
            return "if " + valStrings(i.getOperands()) + " goto " + succs.get(0).getIndex() + " else "
                    + succs.get(1).getIndex();
        case JUMP:
            if (i.getBlock() == null || i.getBlock().getSuccessors().isEmpty()) {
                return "jump";
            }
            return "jump " + i.getBlock().getSuccessors().get(0).getIndex();
        case PANIC:
            return "panic " + valStrings(i.getOperands());
        case RETURN:
            return i.getOperands().isEmpty() ? "return" : "return " + valStrings(i.getOperands());
        default:
            throw new RuntimeException("Unexpected instruction type " + i.getInstructionType());
        }
    }

    /**
     * Print the signature of a function, e.g. "func pkg.f(ok bool) *pkg.A"
     *
     * @param f function
     * @return signature string
     */
    public static String functionString(Function f) {
        StringBuilder sb = new StringBuilder("func ");
        sb.append(f.getQualifiedName()).append("(");
        Iterator<Parameter> iter = f.getParams().iterator();
        while (iter.hasNext()) {
            Parameter p = iter.next();
            sb.append(p.getName()).append(" ").append(p.getType());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        sb.append(")");
        TupleType results = f.getSignature().getResults();
        if (results.size() == 1) {
            sb.append(" ").append(results.get(0));
        }
        else if (results.size() > 1) {
            sb.append(" ").append(results);
        }
        return sb.toString();
    }
}
