package util.print;

import java.io.IOException;
import java.io.StringWriter;

import ir.Function;
import ir.Program;
import ir.serialization.ProgramFixtures;
import ir.serialization.ProgramLoadException;
import junit.framework.TestCase;

public class TestCFGWriter extends TestCase {

    public void testBranches() throws ProgramLoadException, IOException {
        Program p = ProgramFixtures.loadCorpus();
        Function f = p.getFunction("pkg.canReturnNil");
        StringWriter w = new StringWriter();
        new CFGWriter(f).write(w, "", "\\l");
        String dot = w.toString();
        assertTrue(dot, dot.startsWith("digraph G {"));
        assertTrue(dot, dot.contains("ENTRY"));
        assertTrue(dot, dot.contains("ok = param(0)"));
        assertTrue(dot, dot.contains("[label=\"TRUE\"]"));
        assertTrue(dot, dot.contains("[label=\"FALSE\"]"));
        assertTrue(dot, dot.trim().endsWith("};"));
    }

    public void testVerboseShowsInstructions() throws ProgramLoadException, IOException {
        Program p = ProgramFixtures.loadCorpus();
        Function f = p.getFunction("pkg.canReturnNil");
        StringWriter plain = new StringWriter();
        new CFGWriter(f).write(plain, "", "\\l");
        StringWriter verbose = new StringWriter();
        new CFGWriter(f).writeVerbose(verbose, "", "\\l");
        assertFalse(plain.toString().contains("return"));
        assertTrue(verbose.toString(), verbose.toString().contains("return"));
    }
}
