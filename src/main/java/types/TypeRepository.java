package types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import types.ChanType.Direction;

/**
 * Declared types of a program, and a parser for type expressions written in Go syntax.
 *
 * <pre>
 * The grammar is:
 *
 * type ::= "*" type                       // pointer
 *        | "[]" type                      // slice
 *        | "[" int "]" type               // array
 *        | "map[" type "]" type           // map
 *        | "chan" type | "chan&lt;-" type | "&lt;-chan" type
 *        | "func(" types ")" results      // signature
 *        | "struct{" fields "}"           // struct, fields separated by ";"
 *        | "interface{" ... "}"           // interface, body is not interpreted
 *        | "(" types ")"                  // tuple
 *        | name | pkg "." name            // predeclared or declared name
 *
 * results ::= &lt;empty&gt; | type
 * fields ::= &lt;empty&gt; | id type | id type ";" fields
 * </pre>
 */
public class TypeRepository {

    /**
     * Declared types keyed by qualified name, "pkg.Name"
     */
    private final Map<String, NamedType> declared = new LinkedHashMap<>();

    /**
     * Declare a type name in a package. The underlying type must be given later with
     * {@link #define(String, String, String)}.
     *
     * @param pkg package the declaration is in
     * @param name unqualified name
     * @return the new named type
     * @throws TypeParseException if the name is already declared in the package
     */
    public NamedType declare(String pkg, String name) throws TypeParseException {
        String qualified = pkg + "." + name;
        if (declared.containsKey(qualified)) {
            throw new TypeParseException("Duplicate type declaration " + qualified);
        }
        NamedType t = new NamedType(qualified);
        declared.put(qualified, t);
        return t;
    }

    /**
     * Resolve a previously declared name to the type given by the expression
     *
     * @param pkg package the declaration is in
     * @param name unqualified name
     * @param expr type expression for the declaration
     * @throws TypeParseException if the expression cannot be parsed
     */
    public void define(String pkg, String name, String expr) throws TypeParseException {
        NamedType t = declared.get(pkg + "." + name);
        if (t == null) {
            throw new TypeParseException("Type " + pkg + "." + name + " was never declared");
        }
        t.setUnderlying(parse(expr, pkg));
    }

    /**
     * Check that every declared name resolves to a type that is not itself a name
     *
     * @throws TypeParseException if a declaration is unresolved or circular
     */
    public void checkDeclarations() throws TypeParseException {
        for (NamedType t : declared.values()) {
            Set<NamedType> seen = new HashSet<>();
            Type current = t;
            while (current instanceof NamedType) {
                NamedType n = (NamedType) current;
                if (!seen.add(n)) {
                    throw new TypeParseException("Circular type declaration " + t.getName());
                }
                if (!n.isResolved()) {
                    throw new TypeParseException("Type " + n.getName() + " has no definition");
                }
                current = n.getDeclared();
            }
        }
    }

    /**
     * Look up a declared type
     *
     * @param qualified name of the form "pkg.Name"
     * @return declared type or null if there is none
     */
    public NamedType getDeclared(String qualified) {
        return declared.get(qualified);
    }

    public Collection<NamedType> getAllDeclared() {
        return Collections.unmodifiableCollection(declared.values());
    }

    /**
     * Parse a type expression
     *
     * @param expr type in Go syntax
     * @param pkg package unqualified names are resolved in
     * @return parsed type
     * @throws TypeParseException if the expression is malformed or uses an undeclared name
     */
    public Type parse(String expr, String pkg) throws TypeParseException {
        Parser p = new Parser(expr, pkg);
        Type t = p.type();
        p.skipWhiteSpace();
        if (!p.atEnd()) {
            throw p.error("unexpected text after type");
        }
        return t;
    }

    /**
     * Recursive descent parser over a single type expression
     */
    private class Parser {
        private final String s;
        private final String pkg;
        private int ind;

        Parser(String s, String pkg) {
            this.s = s;
            this.pkg = pkg;
        }

        boolean atEnd() {
            return ind >= s.length();
        }

        TypeParseException error(String m) {
            return new TypeParseException("Could not parse type \"" + s + "\" at position " + ind + ": " + m);
        }

        void skipWhiteSpace() {
            while (ind < s.length() && Character.isWhitespace(s.charAt(ind))) {
                ind++;
            }
        }

        boolean consume(String token) {
            skipWhiteSpace();
            if (s.startsWith(token, ind)) {
                ind += token.length();
                return true;
            }
            return false;
        }

        /**
         * Consume a keyword that is not the prefix of a longer identifier
         */
        boolean consumeWord(String word) {
            skipWhiteSpace();
            int end = ind + word.length();
            if (s.startsWith(word, ind) && (end >= s.length() || !isIdentifierPart(s.charAt(end)))) {
                ind = end;
                return true;
            }
            return false;
        }

        void expect(String token) throws TypeParseException {
            if (!consume(token)) {
                throw error("expected \"" + token + "\"");
            }
        }

        Type type() throws TypeParseException {
            skipWhiteSpace();
            if (atEnd()) {
                throw error("missing type");
            }
            if (consume("*")) {
                return new PointerType(type());
            }
            if (consume("[]")) {
                return new SliceType(type());
            }
            if (consume("[")) {
                long length = number();
                expect("]");
                return new ArrayType(length, type());
            }
            if (consume("map[")) {
                Type key = type();
                expect("]");
                return new MapType(key, type());
            }
            if (consume("<-chan")) {
                return new ChanType(type(), Direction.RECV_ONLY);
            }
            if (consumeWord("chan")) {
                if (consume("<-")) {
                    return new ChanType(type(), Direction.SEND_ONLY);
                }
                return new ChanType(type(), Direction.SEND_RECV);
            }
            if (consumeWord("func")) {
                expect("(");
                TupleType params = new TupleType(list(")"));
                return new SignatureType(params, results());
            }
            if (consumeWord("struct")) {
                expect("{");
                return new StructType(fields());
            }
            if (consumeWord("interface")) {
                expect("{");
                return new InterfaceType(balanced());
            }
            if (consume("(")) {
                return new TupleType(list(")"));
            }
            return name();
        }

        TupleType results() throws TypeParseException {
            skipWhiteSpace();
            if (atEnd() || ",;)]}".indexOf(s.charAt(ind)) >= 0) {
                return TupleType.EMPTY;
            }
            if (consume("(")) {
                return new TupleType(list(")"));
            }
            return new TupleType(Collections.singletonList(type()));
        }

        List<Type> list(String close) throws TypeParseException {
            List<Type> types = new ArrayList<>();
            if (consume(close)) {
                return types;
            }
            do {
                types.add(type());
            } while (consume(","));
            expect(close);
            return types;
        }

        List<StructType.Field> fields() throws TypeParseException {
            List<StructType.Field> fields = new ArrayList<>();
            if (consume("}")) {
                return fields;
            }
            do {
                skipWhiteSpace();
                String fieldName = identifier();
                fields.add(new StructType.Field(fieldName, type()));
            } while (consume(";"));
            expect("}");
            return fields;
        }

        /**
         * Text up to the matching close brace, the open brace has already been consumed
         */
        String balanced() throws TypeParseException {
            int start = ind;
            int depth = 1;
            while (ind < s.length()) {
                char c = s.charAt(ind++);
                if (c == '{') {
                    depth++;
                }
                else if (c == '}' && --depth == 0) {
                    return s.substring(start, ind - 1);
                }
            }
            throw error("unbalanced braces");
        }

        long number() throws TypeParseException {
            skipWhiteSpace();
            int start = ind;
            while (ind < s.length() && Character.isDigit(s.charAt(ind))) {
                ind++;
            }
            if (start == ind) {
                throw error("expected array length");
            }
            return Long.parseLong(s.substring(start, ind));
        }

        String identifier() throws TypeParseException {
            int start = ind;
            while (ind < s.length() && isIdentifierPart(s.charAt(ind))) {
                ind++;
            }
            if (start == ind || Character.isDigit(s.charAt(start))) {
                throw error("expected identifier");
            }
            return s.substring(start, ind);
        }

        Type name() throws TypeParseException {
            String first = identifier();
            String qualified;
            if (ind < s.length() && s.charAt(ind) == '.') {
                ind++;
                qualified = first + "." + identifier();
            }
            else {
                if (first.equals("error")) {
                    return NamedType.ERROR;
                }
                BasicType basic = BasicType.forName(first);
                if (basic != null) {
                    return basic;
                }
                qualified = pkg + "." + first;
            }
            BasicType basic = BasicType.forName(qualified);
            if (basic != null) {
                return basic;
            }
            NamedType t = declared.get(qualified);
            if (t == null) {
                throw error("undeclared type " + qualified);
            }
            return t;
        }
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
