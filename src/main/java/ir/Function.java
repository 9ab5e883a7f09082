package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import types.SignatureType;
import types.Type;

/**
 * Function with its control flow graph. A function without basic blocks is external: its body is not available.
 */
public final class Function implements Value {

    private final String pkg;
    private final String name;
    private final SignatureType signature;
    private final List<Parameter> params = new ArrayList<>();
    private final List<FreeVar> freeVars = new ArrayList<>();
    private final List<BasicBlock> blocks = new ArrayList<>();
    private SourcePosition position;

    public Function(String pkg, String name, SignatureType signature) {
        this.pkg = pkg;
        this.name = name;
        this.signature = signature;
    }

    /**
     * Add the next formal parameter
     *
     * @param paramName name of the parameter
     * @param type type of the parameter
     * @return the new parameter
     */
    public Parameter addParameter(String paramName, Type type) {
        Parameter p = new Parameter(paramName, type, this);
        params.add(p);
        return p;
    }

    /**
     * Add the next free variable
     *
     * @param varName name of the free variable
     * @param type type of the free variable
     * @return the new free variable
     */
    public FreeVar addFreeVar(String varName, Type type) {
        FreeVar fv = new FreeVar(varName, type, this);
        freeVars.add(fv);
        return fv;
    }

    /**
     * Append a new empty basic block, the first block created is the entry
     *
     * @return the new block
     */
    public BasicBlock newBlock() {
        BasicBlock bb = new BasicBlock(blocks.size(), this);
        blocks.add(bb);
        return bb;
    }

    public List<Parameter> getParams() {
        return Collections.unmodifiableList(params);
    }

    public List<FreeVar> getFreeVars() {
        return Collections.unmodifiableList(freeVars);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return entry block, null for an external function
     */
    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * @return true if no body is available for this function
     */
    public boolean isExternal() {
        return blocks.isEmpty();
    }

    public SignatureType getSignature() {
        return signature;
    }

    public String getPackage() {
        return pkg;
    }

    /**
     * @return name of the form "pkg.name"
     */
    public String getQualifiedName() {
        return pkg + "." + name;
    }

    public void setPosition(SourcePosition position) {
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Type getType() {
        return signature;
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
