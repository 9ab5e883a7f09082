package types;

/**
 * Interface type. Method sets are not modeled since calls through interfaces are never resolved.
 */
public final class InterfaceType extends Type {

    private final String body;

    /**
     * @param body text between the braces of the interface literal
     */
    public InterfaceType(String body) {
        this.body = body.trim();
    }

    @Override
    public String toString() {
        return "interface{" + body + "}";
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof InterfaceType && body.equals(((InterfaceType) obj).body);
    }
}
