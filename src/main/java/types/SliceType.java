package types;

/**
 * Slice of the element type
 */
public final class SliceType extends Type {

    private final Type elem;

    public SliceType(Type elem) {
        this.elem = elem;
    }

    public Type getElem() {
        return elem;
    }

    @Override
    public String toString() {
        return "[]" + elem;
    }

    @Override
    public int hashCode() {
        return 31 * elem.hashCode() + 2;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SliceType && elem.equals(((SliceType) obj).elem);
    }
}
