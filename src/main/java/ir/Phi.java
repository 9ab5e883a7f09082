package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import types.Type;

/**
 * SSA phi node. The edges are set after creation since they may refer to values defined later in the function.
 */
public class Phi extends ValueInstruction {

    private List<Value> edges = Collections.emptyList();

    public Phi(String name, Type type) {
        super(name, type);
    }

    /**
     * @param edges incoming value for each predecessor of the containing block
     */
    public void setEdges(List<Value> edges) {
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    }

    public List<Value> getEdges() {
        return edges;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.PHI;
    }

    @Override
    public List<Value> getOperands() {
        return edges;
    }
}
