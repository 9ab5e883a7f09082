package types;

/**
 * Thrown when a type expression cannot be parsed or refers to an undeclared name
 */
public class TypeParseException extends Exception {

    private static final long serialVersionUID = 3312094720811853290L;

    public TypeParseException(String m) {
        super(m);
    }
}
