package types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of types, the type of a call to a function with zero or several results
 */
public final class TupleType extends Type {

    /**
     * Type of a call with no results
     */
    public static final TupleType EMPTY = new TupleType(Collections.<Type> emptyList());

    private final List<Type> elements;

    public TupleType(List<Type> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<Type> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public Type get(int i) {
        return elements.get(i);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(elements.get(i));
        }
        return sb.append(")").toString();
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TupleType && elements.equals(((TupleType) obj).elements);
    }
}
