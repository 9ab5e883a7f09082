package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normal termination of the function, returning one value per result of the signature
 */
public class Return extends Instruction {

    private final List<Value> results;

    public Return(List<Value> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public List<Value> getResults() {
        return results;
    }

    @Override
    public InstructionType getInstructionType() {
        return InstructionType.RETURN;
    }

    @Override
    public List<Value> getOperands() {
        return results;
    }
}
