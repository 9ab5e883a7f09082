package types;

/**
 * Pointer to a value of the element type
 */
public final class PointerType extends Type {

    private final Type elem;

    public PointerType(Type elem) {
        assert elem != null;
        this.elem = elem;
    }

    /**
     * @return type of the value pointed to
     */
    public Type getElem() {
        return elem;
    }

    @Override
    public String toString() {
        return "*" + elem;
    }

    @Override
    public int hashCode() {
        return 31 * elem.hashCode() + 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PointerType && elem.equals(((PointerType) obj).elem);
    }
}
