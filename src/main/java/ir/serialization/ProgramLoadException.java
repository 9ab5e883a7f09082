package ir.serialization;

/**
 * Thrown when a serialized program cannot be read or is not a well formed control flow graph
 */
public class ProgramLoadException extends Exception {

    private static final long serialVersionUID = -6307745290245312856L;

    public ProgramLoadException(String m) {
        super(m);
    }

    public ProgramLoadException(String m, Throwable cause) {
        super(m, cause);
    }
}
