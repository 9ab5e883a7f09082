package analysis.nilness;

import ir.Instruction;
import ir.SourcePosition;
import util.print.PrettyPrinter;

/**
 * Uses the position and rendering the frontend recorded on each instruction. Instructions without a rendering are
 * printed in SSA form.
 */
public class RecordedSourceLocator implements SourceLocator {

    @Override
    public SourcePosition getPosition(Instruction i) {
        SourcePosition pos = i.getPosition();
        return pos == null ? SourcePosition.UNKNOWN : pos;
    }

    @Override
    public String getSource(Instruction i) {
        String src = i.getSource();
        if (src == null || src.isEmpty()) {
            return PrettyPrinter.instructionString(i);
        }
        return src;
    }
}
