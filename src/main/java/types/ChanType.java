package types;

/**
 * Channel carrying values of the element type
 */
public final class ChanType extends Type {

    /**
     * Direction values may flow through the channel
     */
    public enum Direction {
        SEND_RECV("chan "), SEND_ONLY("chan<- "), RECV_ONLY("<-chan ");

        private final String prefix;

        private Direction(String prefix) {
            this.prefix = prefix;
        }
    }

    private final Type elem;
    private final Direction dir;

    public ChanType(Type elem, Direction dir) {
        this.elem = elem;
        this.dir = dir;
    }

    public Type getElem() {
        return elem;
    }

    public Direction getDirection() {
        return dir;
    }

    @Override
    public String toString() {
        return dir.prefix + elem;
    }

    @Override
    public int hashCode() {
        return 31 * elem.hashCode() + dir.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ChanType)) {
            return false;
        }
        ChanType other = (ChanType) obj;
        return dir == other.dir && elem.equals(other.elem);
    }
}
