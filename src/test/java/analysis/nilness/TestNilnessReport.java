package analysis.nilness;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.UnsupportedEncodingException;
import java.util.Collections;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.nilness.NilnessReport.Step;
import ir.Const;
import ir.FieldAddr;
import ir.Function;
import ir.serialization.ProgramFixtures;
import ir.serialization.ProgramLoadException;
import junit.framework.TestCase;
import types.BasicType;
import types.PointerType;
import types.SignatureType;
import types.StructType;
import types.TupleType;

public class TestNilnessReport extends TestCase {

    private NilnessReport report;

    @Override
    protected void setUp() throws ProgramLoadException {
        report = NilnessReport.create(new NilnessChecker().analyze(ProgramFixtures.loadCorpus()),
                                      new RecordedSourceLocator());
    }

    public void testPrint() throws UnsupportedEncodingException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        report.print(out);
        String[] lines = bytes.toString("UTF-8").split("\\r?\\n");
        assertEquals(4, lines.length);
        assertEquals("testdata.go:9:15: possible nil pointer dereference: (*A)(nil).X", lines[0]);
        assertEquals("testdata.go:10:15: possible nil pointer dereference: (*A)(nil).a", lines[1]);
        assertEquals("testdata.go:45:19: possible nil pointer dereference: expectNonNilParam(nil)", lines[2]);
        assertEquals("\ttestdata.go:25:7: possible nil pointer dereference: a.X", lines[3]);
    }

    public void testJSON() {
        StringWriter w = new StringWriter();
        report.writeJSON(w);
        JSONObject o = new JSONObject(w.toString());
        assertEquals(NilnessReport.MESSAGE, o.getString("message"));
        JSONArray traces = o.getJSONArray("traces");
        assertEquals(3, traces.length());
        JSONArray last = traces.getJSONArray(2);
        assertEquals(2, last.length());
        JSONObject call = last.getJSONObject(0);
        assertEquals("testdata.go", call.getString("file"));
        assertEquals(45, call.getInt("line"));
        assertEquals(19, call.getInt("column"));
        assertEquals("expectNonNilParam(nil)", call.getString("src"));
    }

    public void testSourceFallsBackToInstruction() {
        NilnessResults results = new NilnessResults();
        PointerType ptr = new PointerType(new StructType(Collections.singletonList(new StructType.Field("X",
                                                                                                       BasicType.INT))));
        FieldAddr fa = new FieldAddr("t0", new PointerType(BasicType.INT), Const.nil(ptr), 0);
        Function f = new Function("p", "f", new SignatureType(TupleType.EMPTY, TupleType.EMPTY));
        new NilnessEvaluator().evaluate(fa, new Frame(f, null, null, null, Trace.EMPTY, results));
        NilnessReport r = NilnessReport.create(results, new RecordedSourceLocator());
        Step s = r.getTraces().get(0).get(0);
        assertEquals("-", s.getPosition().toString());
        assertEquals("t0 = &nil:*struct{X int}.X [#0]", s.getSource());
    }
}
