package types;

import junit.framework.TestCase;

public class TestTypeRepository extends TestCase {

    private TypeRepository types;

    @Override
    protected void setUp() throws Exception {
        types = new TypeRepository();
        types.declare("pkg", "A");
        types.define("pkg", "A", "struct{X int; a *A}");
    }

    public void testRecursiveStruct() throws TypeParseException {
        types.checkDeclarations();
        Type ptr = types.parse("*A", "pkg");
        assertTrue(ptr.isPointer());
        assertTrue(ptr.isPointerToStruct());
        StructType st = (StructType) types.getDeclared("pkg.A").getUnderlying();
        assertEquals(2, st.getFields().size());
        assertEquals(1, st.indexOf("a"));
        assertEquals(-1, st.indexOf("b"));
        assertEquals(ptr, st.getFields().get(1).getType());
    }

    public void testCompositeTypes() throws TypeParseException {
        assertTrue(types.parse("map[string]*A", "pkg").isMap());
        assertTrue(types.parse("map[string]int", "pkg").isReferenceLike());
        assertTrue(types.parse("[]byte", "pkg").isReferenceLike());
        assertTrue(types.parse("<-chan int", "pkg").isReferenceLike());
        assertTrue(types.parse("chan<- bool", "pkg").isReferenceLike());
        assertFalse(types.parse("[4]int", "pkg").isReferenceLike());
        assertFalse(types.parse("*[]int", "pkg").isPointerToStruct());

        SignatureType sig = (SignatureType) types.parse("func(int, *A) (bool, error)", "pkg");
        assertEquals(2, sig.getParams().size());
        assertEquals(2, sig.getResults().size());
        assertSame(NamedType.ERROR, sig.getResults().get(1));
        assertTrue(sig.getCallType() instanceof TupleType);

        SignatureType single = (SignatureType) types.parse("func() *A", "pkg");
        assertEquals(types.parse("*A", "pkg"), single.getCallType());

        Type iface = types.parse("interface{ M(struct{}) }", "pkg");
        assertTrue(iface instanceof InterfaceType);
    }

    public void testQualifiedNames() throws TypeParseException {
        types.declare("other", "B");
        types.define("other", "B", "*pkg.A");
        types.checkDeclarations();
        Type b = types.parse("B", "other");
        assertTrue(b instanceof NamedType);
        assertTrue(b.isPointerToStruct());
        assertSame(BasicType.forName("unsafe.Pointer"), types.parse("unsafe.Pointer", "pkg"));
    }

    public void testUndeclaredName() {
        try {
            types.parse("*B", "pkg");
            fail("Undeclared type was accepted");
        }
        catch (TypeParseException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("pkg.B"));
        }
    }

    public void testMalformed() {
        String[] bad = { "", "*", "map[int", "struct{X}", "[x]int", "int int", "func(" };
        for (String expr : bad) {
            try {
                types.parse(expr, "pkg");
                fail("Accepted malformed type \"" + expr + "\"");
            }
            catch (TypeParseException e) {
                // expected
            }
        }
    }

    public void testDuplicateDeclaration() {
        try {
            types.declare("pkg", "A");
            fail("Duplicate declaration was accepted");
        }
        catch (TypeParseException e) {
            // expected
        }
    }

    public void testCircularDeclaration() throws TypeParseException {
        types.declare("pkg", "C");
        types.declare("pkg", "D");
        types.define("pkg", "C", "D");
        types.define("pkg", "D", "C");
        try {
            types.checkDeclarations();
            fail("Circular declaration was accepted");
        }
        catch (TypeParseException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Circular"));
        }
    }

    public void testMissingDefinition() throws TypeParseException {
        types.declare("pkg", "E");
        try {
            types.checkDeclarations();
            fail("Declaration without definition was accepted");
        }
        catch (TypeParseException e) {
            // expected
        }
    }
}
