package types;

/**
 * Declared type name. The underlying type is set once, after creation, so that recursive declarations such as
 * <code>type A struct{ a *A }</code> can refer to the name.
 */
public final class NamedType extends Type {

    /**
     * Predeclared error interface
     */
    public static final NamedType ERROR = new NamedType("error", new InterfaceType("Error() string"));

    private final String name;
    private Type underlying;

    public NamedType(String name) {
        this.name = name;
    }

    public NamedType(String name, Type underlying) {
        this(name);
        setUnderlying(underlying);
    }

    /**
     * Set the type this name stands for
     *
     * @param underlying type of the declaration
     */
    public void setUnderlying(Type underlying) {
        assert this.underlying == null : "Underlying type of " + name + " already set";
        this.underlying = underlying;
    }

    /**
     * @return true once the declaration has been resolved
     */
    public boolean isResolved() {
        return underlying != null;
    }

    /**
     * Type given in the declaration, which may itself be a name
     *
     * @return declared type or null if not yet resolved
     */
    Type getDeclared() {
        return underlying;
    }

    public String getName() {
        return name;
    }

    @Override
    public Type getUnderlying() {
        assert underlying != null : "Named type " + name + " is not resolved";
        return underlying.getUnderlying();
    }

    @Override
    public String toString() {
        return name;
    }
}
