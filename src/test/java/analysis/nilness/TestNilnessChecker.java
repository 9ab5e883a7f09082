package analysis.nilness;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import analysis.nilness.NilnessReport.Step;
import ir.Function;
import ir.Program;
import ir.serialization.ProgramFixtures;
import ir.serialization.ProgramLoadException;
import junit.framework.TestCase;

/**
 * Runs the checker on the annotated corpus. Every "// MATCH expr" comment must be matched by exactly one trace whose
 * first step is on the same line and renders as expr, and every trace must match a comment.
 */
public class TestNilnessChecker extends TestCase {

    private static final class Expected {
        final int line;
        final String expr;

        Expected(int line, String expr) {
            this.line = line;
            this.expr = expr;
        }

        @Override
        public String toString() {
            return line + ": " + expr;
        }
    }

    private static List<Expected> parseMatches(String resource) throws IOException {
        List<String> lines = Files.readAllLines(ProgramFixtures.resource(resource).toPath(), StandardCharsets.UTF_8);
        List<Expected> expected = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int comment = line.indexOf("//");
            if (comment < 0) {
                continue;
            }
            String text = line.substring(comment + 2).trim();
            if (text.startsWith("MATCH ")) {
                expected.add(new Expected(i + 1, text.substring("MATCH ".length()).trim()));
            }
        }
        return expected;
    }

    private static NilnessReport check(Program p) {
        return NilnessReport.create(new NilnessChecker().analyze(p), new RecordedSourceLocator());
    }

    public void testCorpus() throws IOException, ProgramLoadException {
        List<Expected> expected = parseMatches(ProgramFixtures.CORPUS_SOURCE);
        assertEquals(3, expected.size());
        NilnessReport report = check(ProgramFixtures.loadCorpus());

        List<Step> found = new ArrayList<>();
        for (List<Step> trace : report.getTraces()) {
            found.add(trace.get(0));
        }
        StringBuilder errors = new StringBuilder();
        outer: for (Expected e : expected) {
            Iterator<Step> iter = found.iterator();
            while (iter.hasNext()) {
                Step s = iter.next();
                if (s.getPosition().getLine() == e.line && s.getSource().equals(e.expr)) {
                    iter.remove();
                    continue outer;
                }
            }
            errors.append("did not match: ").append(e).append("\n");
        }
        for (Step s : found) {
            errors.append("unexpected match: ").append(s).append("\n");
        }
        assertTrue(errors.toString(), errors.length() == 0);
    }

    public void testTraceThroughCall() throws ProgramLoadException {
        NilnessReport report = check(ProgramFixtures.loadCorpus());
        List<Step> viaCall = null;
        for (List<Step> trace : report.getTraces()) {
            if (trace.size() > 1) {
                assertNull("more than one trace through a call", viaCall);
                viaCall = trace;
            }
        }
        assertNotNull(viaCall);
        assertEquals(2, viaCall.size());
        assertEquals("expectNonNilParam(nil)", viaCall.get(0).getSource());
        assertEquals("a.X", viaCall.get(1).getSource());
        assertEquals(25, viaCall.get(1).getPosition().getLine());
    }

    public void testIdempotent() throws ProgramLoadException {
        Program p = ProgramFixtures.loadCorpus();
        List<String> first = signatures(check(p));
        List<String> second = signatures(check(p));
        List<String> reloaded = signatures(check(ProgramFixtures.loadCorpus()));
        assertEquals(first, second);
        assertEquals(first, reloaded);
    }

    private static List<String> signatures(NilnessReport report) {
        List<String> sigs = new ArrayList<>();
        for (List<Step> trace : report.getTraces()) {
            sigs.add(trace.toString());
        }
        Collections.sort(sigs);
        return sigs;
    }

    public void testEntryPoints() throws ProgramLoadException {
        Program p = ProgramFixtures.loadCorpus();
        NilnessChecker checker = new NilnessChecker();

        Function nilArg = p.getFunction("pkg.nilArg");
        NilnessResults fromNilArg = checker.analyze(p, Collections.singletonList(nilArg));
        assertEquals(1, fromNilArg.size());

        Function guarded = p.getFunction("pkg.guarded");
        assertTrue(checker.analyze(p, Collections.singletonList(guarded)).isEmpty());

        Function npd = p.getFunction("pkg.npd");
        assertEquals(2, checker.analyze(p, Collections.singletonList(npd)).size());
    }

    public void testSeedsAreAnalyzedInOrder() throws ProgramLoadException {
        Program p = ProgramFixtures.loadCorpus();
        NilnessResults results = new NilnessChecker().analyze(p);
        assertEquals(3, results.size());
        assertEquals("pkg.npd", results.getTraces().get(0).getLast().getFunction().getQualifiedName());
        assertEquals("pkg.npd", results.getTraces().get(1).getLast().getFunction().getQualifiedName());
        assertEquals("pkg.nilArg", results.getTraces().get(2).get(0).getFunction().getQualifiedName());
    }
}
