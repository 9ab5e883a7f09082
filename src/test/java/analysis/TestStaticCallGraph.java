package analysis;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import ir.Function;
import ir.Program;
import ir.serialization.JSONProgramReader;
import ir.serialization.ProgramFixtures;
import ir.serialization.ProgramLoadException;
import junit.framework.TestCase;

public class TestStaticCallGraph extends TestCase {

    public void testCorpus() throws ProgramLoadException {
        Program p = ProgramFixtures.loadCorpus();
        StaticCallGraph cg = new StaticCallGraph(p);
        assertEquals(7, cg.getNumberOfFunctions());
        Function interproc = p.getFunction("pkg.interproc");
        Function canReturnNil = p.getFunction("pkg.canReturnNil");
        assertTrue(cg.hasEdge(interproc, canReturnNil));
        assertFalse(cg.hasEdge(canReturnNil, interproc));

        Set<Function> reachable = cg.getReachableFunctions(Collections.singletonList(interproc));
        assertEquals(2, reachable.size());
        assertSame(interproc, reachable.iterator().next());
        assertTrue(reachable.contains(canReturnNil));
        assertTrue(cg.getRecursiveComponents().isEmpty());
    }

    public void testRecursionAndClosures() throws ProgramLoadException {
        String doc = "{\"package\": \"p\", \"functions\": ["
                + "{\"name\": \"even\", \"blocks\": [{\"succs\": [], \"instrs\": ["
                + "  {\"op\": \"call\", \"name\": \"t0\", \"func\": \"odd\"}, {\"op\": \"return\"}]}]},"
                + "{\"name\": \"odd\", \"blocks\": [{\"succs\": [], \"instrs\": ["
                + "  {\"op\": \"call\", \"name\": \"t0\", \"func\": \"even\"}, {\"op\": \"return\"}]}]},"
                + "{\"name\": \"self\", \"blocks\": [{\"succs\": [], \"instrs\": ["
                + "  {\"op\": \"call\", \"name\": \"t0\", \"func\": \"self\"}, {\"op\": \"return\"}]}]},"
                + "{\"name\": \"outer\", \"blocks\": [{\"succs\": [], \"instrs\": ["
                + "  {\"op\": \"makeclosure\", \"name\": \"t0\", \"fn\": \"outer$1\"}, {\"op\": \"return\"}]}]},"
                + "{\"name\": \"outer$1\", \"blocks\": [{\"succs\": [], \"instrs\": [{\"op\": \"return\"}]}]}]}";
        JSONProgramReader reader = new JSONProgramReader();
        reader.addDocument(doc, "rec.json");
        Program p = reader.finish();
        StaticCallGraph cg = new StaticCallGraph(p);

        List<Set<Function>> recursive = cg.getRecursiveComponents();
        assertEquals(2, recursive.size());
        int pairs = 0;
        for (Set<Function> scc : recursive) {
            if (scc.size() == 2) {
                pairs++;
                assertTrue(scc.contains(p.getFunction("p.even")));
                assertTrue(scc.contains(p.getFunction("p.odd")));
            }
            else {
                assertEquals(Collections.singleton(p.getFunction("p.self")), scc);
            }
        }
        assertEquals(1, pairs);
        assertTrue(cg.hasEdge(p.getFunction("p.outer"), p.getFunction("p.outer$1")));
        assertEquals(2, cg.getReachableFunctions(Collections.singletonList(p.getFunction("p.outer"))).size());
    }
}
