package types;

/**
 * Fixed length array of the element type
 */
public final class ArrayType extends Type {

    private final long length;
    private final Type elem;

    public ArrayType(long length, Type elem) {
        this.length = length;
        this.elem = elem;
    }

    public long getLength() {
        return length;
    }

    public Type getElem() {
        return elem;
    }

    @Override
    public String toString() {
        return "[" + length + "]" + elem;
    }

    @Override
    public int hashCode() {
        return 31 * elem.hashCode() + (int) length;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ArrayType)) {
            return false;
        }
        ArrayType other = (ArrayType) obj;
        return length == other.length && elem.equals(other.elem);
    }
}
