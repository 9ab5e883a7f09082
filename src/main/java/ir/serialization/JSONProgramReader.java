package ir.serialization;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

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
import ir.Jump;
import ir.Lookup;
import ir.MakeClosure;
import ir.OpaqueInstruction;
import ir.OpaqueValue;
import ir.Panic;
import ir.Parameter;
import ir.Phi;
import ir.Program;
import ir.Return;
import ir.SourcePosition;
import ir.UnOp;
import ir.Value;
import ir.ValueInstruction;
import types.BasicType;
import types.MapType;
import types.PointerType;
import types.SignatureType;
import types.StructType;
import types.TupleType;
import types.Type;
import types.TypeParseException;
import types.TypeRepository;

/**
 * Reads programs that a compiler frontend lowered to SSA form and serialized as JSON, one document per package:
 *
 * <pre>
 * { "package": "pkg", "file": "pkg.go",
 *   "types":     [ {"name": "A", "type": "struct{X int; a *A}"} ],
 *   "globals":   [ {"name": "g", "type": "*A"} ],
 *   "functions": [ {"name": "f", "pos": "3:6", "params": [{"name": "p", "type": "*A"}], "freeVars": [],
 *                   "results": "int", "blocks": [ {"succs": [], "instrs": [ ... ]} ] } ] }
 * </pre>
 *
 * Documents are collected with {@link #addFile(File)} or {@link #addDocument(String, String)} and resolved together
 * by {@link #finish()}, so packages may refer to each other in any order.
 */
public class JSONProgramReader {

    /**
     * Instructions producing a value, these must have a name
     */
    private static final Set<String> VALUES = new HashSet<>(Arrays.asList("alloc", "binop", "unop", "call",
            "makeclosure", "extract", "fieldaddr", "lookup", "phi"));
    /**
     * Value instructions the analysis does not interpret
     */
    private static final Set<String> OPAQUE_VALUES = new HashSet<>(Arrays.asList("convert", "changetype",
            "changeinterface", "makeinterface", "makemap", "makechan", "makeslice", "slice", "index", "indexaddr",
            "typeassert", "range", "next", "select", "field"));
    /**
     * Instructions executed for their effect only
     */
    private static final Set<String> OPAQUE_EFFECTS = new HashSet<>(Arrays.asList("store", "mapupdate", "send", "go",
            "defer", "rundefers", "debugref"));

    private final Program program = new Program();
    /**
     * Documents in the order they were added, with a description of where each came from
     */
    private final Map<String, JSONObject> documents = new LinkedHashMap<>();
    private boolean finished;

    /**
     * Read and resolve the given files
     *
     * @param files one JSON document per package
     * @return the whole program
     * @throws ProgramLoadException if any file cannot be read or is malformed
     */
    public static Program read(List<File> files) throws ProgramLoadException {
        JSONProgramReader reader = new JSONProgramReader();
        for (File f : files) {
            reader.addFile(f);
        }
        return reader.finish();
    }

    /**
     * Add the document in a file
     *
     * @param f JSON file
     * @throws ProgramLoadException if the file cannot be read or is not a JSON object
     */
    public void addFile(File f) throws ProgramLoadException {
        String text;
        try {
            text = new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new ProgramLoadException("Could not read " + f + ": " + e.getMessage(), e);
        }
        addDocument(text, f.getPath());
    }

    /**
     * Add a document
     *
     * @param json text of the document
     * @param origin where the document came from, used in error messages
     * @throws ProgramLoadException if the text is not a JSON object
     */
    public void addDocument(String json, String origin) throws ProgramLoadException {
        if (finished) {
            throw new IllegalStateException("Program already resolved");
        }
        try {
            JSONObject doc = new JSONObject(json);
            doc.getString("package");
            documents.put(origin + "#" + documents.size(), doc);
        }
        catch (JSONException e) {
            throw new ProgramLoadException(origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolve every document added so far: types first, then globals and function signatures, then function bodies
     *
     * @return the program
     * @throws ProgramLoadException if a document is malformed
     */
    public Program finish() throws ProgramLoadException {
        if (finished) {
            return program;
        }
        finished = true;
        TypeRepository types = program.getTypes();
        try {
            for (Map.Entry<String, JSONObject> e : documents.entrySet()) {
                String pkg = e.getValue().getString("package");
                for (JSONObject t : objects(e.getValue().optJSONArray("types"))) {
                    types.declare(pkg, t.getString("name"));
                }
            }
            for (Map.Entry<String, JSONObject> e : documents.entrySet()) {
                String pkg = e.getValue().getString("package");
                for (JSONObject t : objects(e.getValue().optJSONArray("types"))) {
                    types.define(pkg, t.getString("name"), t.getString("type"));
                }
            }
            types.checkDeclarations();
        }
        catch (JSONException | TypeParseException e) {
            throw new ProgramLoadException("Bad type declaration: " + e.getMessage(), e);
        }

        List<FunctionReader> bodies = new ArrayList<>();
        for (Map.Entry<String, JSONObject> e : documents.entrySet()) {
            String origin = e.getKey().substring(0, e.getKey().lastIndexOf('#'));
            try {
                bodies.addAll(readDeclarations(e.getValue()));
            }
            catch (JSONException | TypeParseException | IllegalArgumentException ex) {
                throw new ProgramLoadException(origin + ": " + ex.getMessage(), ex);
            }
        }
        for (FunctionReader r : bodies) {
            try {
                r.read();
            }
            catch (JSONException | TypeParseException | IllegalArgumentException ex) {
                throw new ProgramLoadException(r.function.getQualifiedName() + ": " + ex.getMessage(), ex);
            }
        }
        return program;
    }

    /**
     * Create the globals and functions of a document, the function bodies are read later
     */
    private List<FunctionReader> readDeclarations(JSONObject doc) throws TypeParseException, ProgramLoadException {
        String pkg = doc.getString("package");
        String file = doc.optString("file", null);
        TypeRepository types = program.getTypes();
        for (JSONObject g : objects(doc.optJSONArray("globals"))) {
            Global global = new Global(pkg, g.getString("name"), types.parse(g.getString("type"), pkg));
            if (program.getGlobal(global.getQualifiedName()) != null) {
                throw new ProgramLoadException("Duplicate global " + global.getQualifiedName());
            }
            program.addGlobal(global);
        }
        List<FunctionReader> readers = new ArrayList<>();
        for (JSONObject f : objects(doc.optJSONArray("functions"))) {
            List<Type> paramTypes = new ArrayList<>();
            JSONArray params = f.optJSONArray("params");
            for (JSONObject p : objects(params)) {
                paramTypes.add(types.parse(p.getString("type"), pkg));
            }
            TupleType results = TupleType.EMPTY;
            String r = f.optString("results", "");
            if (!r.trim().isEmpty()) {
                Type rt = types.parse(r, pkg);
                results = rt instanceof TupleType ? (TupleType) rt : new TupleType(Collections.singletonList(rt));
            }
            Function fn = new Function(pkg, f.getString("name"), new SignatureType(new TupleType(paramTypes), results));
            if (program.getFunction(fn.getQualifiedName()) != null) {
                throw new ProgramLoadException("Duplicate function " + fn.getQualifiedName());
            }
            int i = 0;
            for (JSONObject p : objects(params)) {
                fn.addParameter(p.getString("name"), paramTypes.get(i++));
            }
            for (JSONObject fv : objects(f.optJSONArray("freeVars"))) {
                fn.addFreeVar(fv.getString("name"), types.parse(fv.getString("type"), pkg));
            }
            if (f.has("pos")) {
                fn.setPosition(SourcePosition.parse(f.getString("pos"), file));
            }
            program.addFunction(fn);
            readers.add(new FunctionReader(fn, f, file));
        }
        return readers;
    }

    private static List<JSONObject> objects(JSONArray a) {
        if (a == null) {
            return Collections.emptyList();
        }
        List<JSONObject> l = new ArrayList<>(a.length());
        for (int i = 0; i < a.length(); i++) {
            l.add(a.getJSONObject(i));
        }
        return l;
    }

    /**
     * Reads the body of one function. Instructions may refer to values defined later in the document, so value
     * instructions are built on demand when first referred to.
     */
    private class FunctionReader {
        final Function function;
        private final JSONObject json;
        private final String file;
        private final String pkg;
        /**
         * Definition of every named value instruction
         */
        private final Map<String, JSONObject> definitions = new HashMap<>();
        private final Map<String, ValueInstruction> built = new HashMap<>();
        /**
         * Values currently being built, to detect definitions that depend on themselves
         */
        private final Set<String> inProgress = new HashSet<>();

        FunctionReader(Function function, JSONObject json, String file) {
            this.function = function;
            this.json = json;
            this.file = file;
            this.pkg = function.getPackage();
        }

        void read() throws ProgramLoadException, TypeParseException {
            List<JSONObject> blocks = objects(json.optJSONArray("blocks"));
            if (blocks.isEmpty()) {
                // external
                return;
            }
            for (int i = 0; i < blocks.size(); i++) {
                function.newBlock();
            }
            for (JSONObject b : blocks) {
                for (JSONObject instr : objects(b.optJSONArray("instrs"))) {
                    String name = instr.optString("name", null);
                    if (name != null) {
                        if (definitions.put(name, instr) != null) {
                            throw new ProgramLoadException("Value " + name + " is defined twice");
                        }
                    }
                }
            }
            // phi nodes first so that cycles through them can be closed
            List<Phi> phis = new ArrayList<>();
            List<JSONObject> phiDefs = new ArrayList<>();
            for (Map.Entry<String, JSONObject> e : definitions.entrySet()) {
                if (e.getValue().getString("op").equals("phi")) {
                    Phi phi = new Phi(e.getKey(), type(e.getValue()));
                    built.put(e.getKey(), phi);
                    phis.add(phi);
                    phiDefs.add(e.getValue());
                }
            }
            for (int i = 0; i < phis.size(); i++) {
                phis.get(i).setEdges(operands(phiDefs.get(i).getJSONArray("edges")));
            }

            for (int i = 0; i < blocks.size(); i++) {
                BasicBlock bb = function.getBlocks().get(i);
                JSONObject b = blocks.get(i);
                for (JSONObject instr : objects(b.optJSONArray("instrs"))) {
                    String name = instr.optString("name", null);
                    Instruction ins = name == null ? buildInstruction(instr) : value(name);
                    if (ins.getBlock() != null) {
                        throw new ProgramLoadException("Instruction " + name + " appears twice");
                    }
                    bb.add(ins);
                    String pos = instr.optString("pos", null);
                    ins.setSource(pos == null ? null : SourcePosition.parse(pos, file), instr.optString("src", null));
                }
                JSONArray succs = b.optJSONArray("succs");
                for (int j = 0; succs != null && j < succs.length(); j++) {
                    int s = succs.getInt(j);
                    if (s < 0 || s >= blocks.size()) {
                        throw new ProgramLoadException("Block " + i + " has no successor " + s);
                    }
                    bb.addSuccessor(function.getBlocks().get(s));
                }
                checkBlock(bb);
            }
        }

        /**
         * Check terminators, successor counts and return arity
         */
        private void checkBlock(BasicBlock bb) throws ProgramLoadException {
            List<Instruction> instrs = bb.getInstructions();
            for (int i = 0; i < instrs.size() - 1; i++) {
                if (instrs.get(i).isTerminator()) {
                    throw new ProgramLoadException("Terminator in the middle of block " + bb);
                }
            }
            if (instrs.isEmpty()) {
                return;
            }
            Instruction last = bb.getLastInstruction();
            int expected;
            switch (last.getInstructionType()) {
            case IF:
                expected = 2;
                break;
            case JUMP:
                expected = 1;
                break;
            case RETURN:
                int arity = ((Return) last).getResults().size();
                if (arity != function.getSignature().getResults().size()) {
                    throw new ProgramLoadException("Return in block " + bb + " has " + arity + " results, expected "
                            + function.getSignature().getResults().size());
                }
                expected = 0;
                break;
            case PANIC:
                expected = 0;
                break;
            default:
                throw new ProgramLoadException("Block " + bb + " does not end in a terminator");
            }
            if (bb.getSuccessors().size() != expected) {
                throw new ProgramLoadException("Block " + bb + " has " + bb.getSuccessors().size()
                        + " successors, expected " + expected);
            }
        }

        private ValueInstruction value(String name) throws ProgramLoadException, TypeParseException {
            ValueInstruction v = built.get(name);
            if (v != null) {
                return v;
            }
            if (!inProgress.add(name)) {
                throw new ProgramLoadException("Definition of " + name + " depends on itself");
            }
            Instruction i = buildInstruction(definitions.get(name));
            inProgress.remove(name);
            if (!(i instanceof ValueInstruction)) {
                throw new ProgramLoadException("Instruction " + name + " does not produce a value");
            }
            built.put(name, (ValueInstruction) i);
            return (ValueInstruction) i;
        }

        private Type type(JSONObject j) throws TypeParseException {
            return program.getTypes().parse(j.getString("type"), pkg);
        }

        private Type typeOr(JSONObject j, Type derived) throws TypeParseException, ProgramLoadException {
            if (j.has("type")) {
                return type(j);
            }
            if (derived == null) {
                throw new ProgramLoadException("Missing type for " + j.optString("name", j.getString("op")));
            }
            return derived;
        }

        private Instruction buildInstruction(JSONObject j) throws ProgramLoadException, TypeParseException {
            String op = j.getString("op");
            String name = j.optString("name", null);
            if (name == null && VALUES.contains(op)) {
                throw new ProgramLoadException("Instruction " + op + " must be named");
            }
            switch (op) {
            case "alloc":
                Type at = type(j);
                if (!at.isPointer()) {
                    throw new ProgramLoadException("Allocation " + name + " must have pointer type, not " + at);
                }
                return new Alloc(name, at, j.optBoolean("heap", false));
            case "binop":
                BinaryOperator bop = BinaryOperator.forSymbol(j.getString("operator"));
                if (bop == null) {
                    throw new ProgramLoadException("Unknown operator " + j.getString("operator"));
                }
                Value x = operand(j.get("x"));
                return new BinOp(name, typeOr(j, bop.isComparison() ? BasicType.BOOL : x.getType()), bop, x,
                                 operand(j.get("y")));
            case "unop":
                return new UnOp(name, type(j), j.getString("operator"), operand(j.get("x")),
                                j.optBoolean("commaOk", false));
            case "call":
                List<Value> args = operands(j.optJSONArray("args"));
                if (j.has("invoke")) {
                    JSONObject inv = j.getJSONObject("invoke");
                    return Call.invoke(name, typeOr(j, TupleType.EMPTY), operand(inv.get("recv")),
                                       inv.getString("method"), args);
                }
                Value callee = operand(j.get("func"));
                Type derived = null;
                if (callee.getType().getUnderlying() instanceof SignatureType) {
                    derived = ((SignatureType) callee.getType().getUnderlying()).getCallType();
                }
                return Call.call(name, typeOr(j, derived), callee, args);
            case "makeclosure":
                Value fn = operand(j.get("fn"));
                if (!(fn instanceof Function)) {
                    throw new ProgramLoadException("Closure " + name + " of " + fn + " which is not a function");
                }
                List<Value> bindings = operands(j.optJSONArray("bindings"));
                if (bindings.size() != ((Function) fn).getFreeVars().size()) {
                    throw new ProgramLoadException("Closure " + name + " binds " + bindings.size()
                            + " values but " + fn + " has " + ((Function) fn).getFreeVars().size() + " free variables");
                }
                return new MakeClosure(name, typeOr(j, fn.getType()), (Function) fn, bindings);
            case "extract":
                Value tuple = operand(j.get("tuple"));
                int index = j.getInt("index");
                Type tt = tuple.getType().getUnderlying();
                Type elem = null;
                if (tt instanceof TupleType) {
                    if (index < 0 || index >= ((TupleType) tt).size()) {
                        throw new ProgramLoadException("Extract " + name + " index " + index + " out of range for "
                                + tt);
                    }
                    elem = ((TupleType) tt).get(index);
                }
                return new Extract(name, typeOr(j, elem), tuple, index);
            case "fieldaddr":
                return buildFieldAddr(j, name);
            case "lookup":
                Value m = operand(j.get("x"));
                boolean commaOk = j.optBoolean("commaOk", false);
                Type lt = null;
                if (m.getType().getUnderlying() instanceof MapType) {
                    Type me = ((MapType) m.getType().getUnderlying()).getElem();
                    lt = commaOk ? new TupleType(Arrays.asList(me, BasicType.BOOL)) : me;
                }
                return new Lookup(name, typeOr(j, lt), m, operand(j.get("index")), commaOk);
            case "if":
                return new If(operand(j.get("cond")));
            case "jump":
                return new Jump();
            case "panic":
                return new Panic(operand(j.get("x")));
            case "return":
                return new Return(operands(j.optJSONArray("results")));
            default:
                if (OPAQUE_VALUES.contains(op) && name != null) {
                    return new OpaqueValue(name, type(j), op, operands(j.optJSONArray("operands")));
                }
                if (OPAQUE_EFFECTS.contains(op) && name == null) {
                    return new OpaqueInstruction(op, operands(j.optJSONArray("operands")));
                }
                throw new ProgramLoadException("Unknown instruction " + op + (name == null ? "" : " for " + name));
            }
        }

        private FieldAddr buildFieldAddr(JSONObject j, String name) throws ProgramLoadException, TypeParseException {
            Value base = operand(j.get("x"));
            if (!base.getType().isPointerToStruct()) {
                throw new ProgramLoadException("Field address " + name + " of " + base + " of type "
                        + base.getType() + " which is not a pointer to a struct");
            }
            StructType st = (StructType) ((PointerType) base.getType().getUnderlying()).getElem().getUnderlying();
            Object field = j.get("field");
            int index = field instanceof Number ? ((Number) field).intValue() : st.indexOf(field.toString());
            if (index < 0 || index >= st.getFields().size()) {
                throw new ProgramLoadException("No field " + field + " in " + st);
            }
            Type ft = new PointerType(st.getFields().get(index).getType());
            return new FieldAddr(name, typeOr(j, ft), base, index);
        }

        private List<Value> operands(JSONArray a) throws ProgramLoadException, TypeParseException {
            if (a == null) {
                return Collections.emptyList();
            }
            List<Value> l = new ArrayList<>(a.length());
            for (int i = 0; i < a.length(); i++) {
                l.add(operand(a.get(i)));
            }
            return l;
        }

        /**
         * Resolve an operand: a constant object, or a name of a value instruction, parameter, free variable, global
         * or function, in that order
         */
        private Value operand(Object o) throws ProgramLoadException, TypeParseException {
            if (o instanceof JSONObject) {
                return constant((JSONObject) o);
            }
            if (!(o instanceof String)) {
                throw new ProgramLoadException("Bad operand " + o);
            }
            String name = (String) o;
            if (definitions.containsKey(name)) {
                return value(name);
            }
            for (Parameter p : function.getParams()) {
                if (p.getName().equals(name)) {
                    return p;
                }
            }
            for (FreeVar fv : function.getFreeVars()) {
                if (fv.getName().equals(name)) {
                    return fv;
                }
            }
            Value v = global(pkg + "." + name);
            if (v == null && name.indexOf('.') > 0) {
                v = global(name);
            }
            if (v == null) {
                throw new ProgramLoadException("Unknown operand " + name);
            }
            return v;
        }

        private Value global(String qualified) {
            Global g = program.getGlobal(qualified);
            if (g != null) {
                return g;
            }
            return program.getFunction(qualified);
        }

        private Const constant(JSONObject j) throws ProgramLoadException, TypeParseException {
            Object c = j.opt("const");
            if (c == null || c == JSONObject.NULL) {
                return Const.nil(j.has("type") ? type(j) : BasicType.UNTYPED_NIL);
            }
            if (c instanceof Boolean) {
                return Const.bool((Boolean) c, j.has("type") ? type(j) : BasicType.BOOL);
            }
            if (c instanceof Number) {
                return Const.number(c instanceof BigDecimal ? (BigDecimal) c : new BigDecimal(c.toString()),
                                    j.has("type") ? type(j) : BasicType.INT);
            }
            if (c instanceof String) {
                return Const.string((String) c, j.has("type") ? type(j) : BasicType.STRING);
            }
            if (c instanceof JSONArray && ((JSONArray) c).length() == 2) {
                JSONArray a = (JSONArray) c;
                return Const.complex(a.getDouble(0), a.getDouble(1), type(j));
            }
            throw new ProgramLoadException("Bad constant " + j);
        }
    }
}
