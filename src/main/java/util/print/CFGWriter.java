package util.print;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

import ir.BasicBlock;
import ir.Function;
import ir.InstructionType;
import ir.Instruction;
import ir.Parameter;
import util.Logger;

/**
 * Write out the control flow graph of a function in graphviz dot format
 */
public class CFGWriter {

    private final Function function;
    /**
     * If true then code will be included in CFG, otherwise it will just be basic block numbers
     */
    private boolean verbose;
    /**
     * Holds the string representation of the basic blocks
     */
    private final Map<BasicBlock, String> bbStrings = new HashMap<>();
    /**
     * String to prepend to instructions
     */
    private String prefix;
    /**
     * String to append to instructions
     */
    private String postfix;

    public CFGWriter(Function function) {
        assert function != null && !function.isExternal() : "Cannot print CFG for function without a body";
        this.function = function;
    }

    /**
     * Write out the graph with block numbers only
     *
     * @param writer writer to write the code to, will not be closed
     * @param prefix prepended to each instruction (e.g. "\t" to indent)
     * @param postfix appended to each instruction (e.g. "\\l" to left align each instruction on its own line)
     * @throws IOException writer issues
     */
    public final void write(Writer writer, String prefix, String postfix) throws IOException {
        this.prefix = prefix;
        this.postfix = postfix;
        double spread = 1.0;
        writer.write("digraph G {\n" + "node [shape=record];\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread
                + ";\n" + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]"
                + ";\n");
        writeGraph(writer);
        writer.write("\n};\n");
    }

    /**
     * Write out the graph with the code of each basic block written on its node
     *
     * @param writer writer to write the code to, will not be closed
     * @param prefix prepended to each instruction
     * @param postfix appended to each instruction
     * @throws IOException writer issues
     */
    public final void writeVerbose(Writer writer, String prefix, String postfix) throws IOException {
        this.verbose = true;
        write(writer, prefix, postfix);
    }

    /**
     * Write the CFG of a function to "cfg_&lt;qualified name&gt;.dot" in the given directory
     *
     * @param f function to write
     * @param dir output directory, created if missing
     */
    public static final void writeToFile(Function f, String dir) {
        CFGWriter cfg = new CFGWriter(f);
        File d = new File(dir);
        if (!d.isDirectory() && !d.mkdirs()) {
            System.err.println("Could not create directory " + dir + " for DOT output");
            return;
        }
        String fullFilename = dir + File.separator + "cfg_" + f.getQualifiedName() + ".dot";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            cfg.writeVerbose(out, "", "\\l");
            Logger.println(1, "DOT written to: " + fullFilename);
        }
        catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
        }
    }

    private void writeGraph(Writer writer) throws IOException {
        for (BasicBlock current : function.getBlocks()) {
            String currentString = getStringForBasicBlock(current);
            for (BasicBlock succ : current.getSuccessors()) {
                String edgeLabel = "[label=\"" + getEdgeLabel(current, succ) + "\"]";
                writer.write("\t\"" + currentString + "\" -> \"" + getStringForBasicBlock(succ) + "\" " + edgeLabel
                        + ";\n");
            }
        }
    }

    private String getStringForBasicBlock(BasicBlock bb) {
        String bbString = bbStrings.get(bb);
        if (bbString == null) {
            StringBuilder sb = new StringBuilder();
            sb.append("BB" + bb.getIndex() + "\\l");
            if (bb == function.getEntryBlock()) {
                sb.append("ENTRY " + PrettyPrinter.functionString(function) + "\\l");
                int j = 0;
                for (Parameter p : function.getParams()) {
                    sb.append(p.getName() + " = param(" + j++ + ")\\l");
                }
            }
            if (verbose) {
                for (Instruction i : bb) {
                    sb.append(prefix + PrettyPrinter.instructionString(i) + postfix);
                }
            }
            bbString = escapeDot(sb.toString());
            bbStrings.put(bb, bbString);
        }
        return bbString;
    }

    /**
     * Properly escape the string so it will be properly formatted in dot
     */
    private static String escapeDot(String s) {
        return s.replace("\"", "\\\"").replace("\n", "\\l");
    }

    private static String getEdgeLabel(BasicBlock source, BasicBlock target) {
        Instruction last = source.getLastInstruction();
        if (last != null && last.getInstructionType() == InstructionType.IF) {
            return source.getSuccessors().get(0) == target ? "TRUE" : "FALSE";
        }
        return "NORMAL";
    }
}
