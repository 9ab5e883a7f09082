package analysis.nilness;

import ir.Instruction;
import ir.SourcePosition;

/**
 * Maps an instruction of a trace back to the source code it was compiled from
 */
public interface SourceLocator {

    /**
     * @param i instruction
     * @return position of the instruction, {@link SourcePosition#UNKNOWN} if there is none
     */
    SourcePosition getPosition(Instruction i);

    /**
     * @param i instruction
     * @return source text of the instruction
     */
    String getSource(Instruction i);
}
