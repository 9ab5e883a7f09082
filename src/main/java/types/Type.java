package types;

/**
 * Static type of a value in the control flow graph
 */
public abstract class Type {

    /**
     * Underlying type, i.e. the type with all names resolved. Only {@link NamedType} differs from its underlying type.
     *
     * @return underlying type
     */
    public Type getUnderlying() {
        return this;
    }

    /**
     * Whether values of this type are references to composite structures that start out uninitialized (channel, map,
     * slice)
     *
     * @return true if the underlying type is a channel, map or slice
     */
    public final boolean isReferenceLike() {
        Type u = getUnderlying();
        return u instanceof ChanType || u instanceof MapType || u instanceof SliceType;
    }

    /**
     * @return true if the underlying type is a pointer
     */
    public final boolean isPointer() {
        return getUnderlying() instanceof PointerType;
    }

    /**
     * @return true if the underlying type is a pointer to a (possibly named) struct
     */
    public final boolean isPointerToStruct() {
        Type u = getUnderlying();
        return u instanceof PointerType && ((PointerType) u).getElem().getUnderlying() instanceof StructType;
    }

    /**
     * @return true if the underlying type is a map
     */
    public final boolean isMap() {
        return getUnderlying() instanceof MapType;
    }

    /**
     * Go syntax for this type
     */
    @Override
    public abstract String toString();
}
