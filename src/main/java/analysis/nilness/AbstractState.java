package analysis.nilness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Disjunction of {@link Alternative}s: every concrete execution realizes one of them. Paths are not tracked, so after
 * a merge unrelated alternatives may coexist. The empty state means no information could be derived; it does not
 * mean the value is non-zero.
 */
public final class AbstractState implements Iterable<Alternative> {

    /**
     * No information
     */
    public static final AbstractState EMPTY = new AbstractState(Collections.<Alternative> emptyList());

    private final List<Alternative> alternatives;

    private AbstractState(List<Alternative> alternatives) {
        this.alternatives = alternatives;
    }

    public static AbstractState of(Alternative... alternatives) {
        if (alternatives.length == 0) {
            return EMPTY;
        }
        List<Alternative> l = new ArrayList<>(alternatives.length);
        Collections.addAll(l, alternatives);
        return new AbstractState(Collections.unmodifiableList(l));
    }

    public boolean isEmpty() {
        return alternatives.isEmpty();
    }

    public int size() {
        return alternatives.size();
    }

    public Alternative get(int i) {
        return alternatives.get(i);
    }

    /**
     * @return true if at least one alternative is zero
     */
    public boolean mayBeZero() {
        for (Alternative a : alternatives) {
            if (a.isZero()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if at least one alternative is non-zero
     */
    public boolean mayBeNonZero() {
        for (Alternative a : alternatives) {
            if (!a.isZero()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<Alternative> iterator() {
        return alternatives.iterator();
    }

    @Override
    public String toString() {
        return alternatives.toString();
    }

    /**
     * Accumulates alternatives in order, duplicates are kept
     */
    public static final class Builder {
        private final List<Alternative> alternatives = new ArrayList<>();

        public Builder add(Alternative a) {
            alternatives.add(a);
            return this;
        }

        public Builder addAll(AbstractState s) {
            alternatives.addAll(s.alternatives);
            return this;
        }

        public AbstractState build() {
            if (alternatives.isEmpty()) {
                return EMPTY;
            }
            return new AbstractState(Collections.unmodifiableList(new ArrayList<>(alternatives)));
        }
    }
}
