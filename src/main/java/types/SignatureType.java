package types;

/**
 * Type of a function: parameter types and result types
 */
public final class SignatureType extends Type {

    private final TupleType params;
    private final TupleType results;

    public SignatureType(TupleType params, TupleType results) {
        this.params = params;
        this.results = results;
    }

    public TupleType getParams() {
        return params;
    }

    public TupleType getResults() {
        return results;
    }

    /**
     * Type of a call to a function with this signature: the single result type, or a tuple otherwise
     *
     * @return type of the call expression
     */
    public Type getCallType() {
        if (results.size() == 1) {
            return results.get(0);
        }
        return results;
    }

    @Override
    public String toString() {
        String r;
        if (results.size() == 0) {
            r = "";
        }
        else if (results.size() == 1) {
            r = " " + results.get(0);
        }
        else {
            r = " " + results;
        }
        return "func" + params + r;
    }

    @Override
    public int hashCode() {
        return 31 * params.hashCode() + results.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SignatureType)) {
            return false;
        }
        SignatureType other = (SignatureType) obj;
        return params.equals(other.params) && results.equals(other.results);
    }
}
