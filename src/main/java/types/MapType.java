package types;

/**
 * Map from key type to element type
 */
public final class MapType extends Type {

    private final Type key;
    private final Type elem;

    public MapType(Type key, Type elem) {
        this.key = key;
        this.elem = elem;
    }

    public Type getKey() {
        return key;
    }

    public Type getElem() {
        return elem;
    }

    @Override
    public String toString() {
        return "map[" + key + "]" + elem;
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + elem.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof MapType)) {
            return false;
        }
        MapType other = (MapType) obj;
        return key.equals(other.key) && elem.equals(other.elem);
    }
}
