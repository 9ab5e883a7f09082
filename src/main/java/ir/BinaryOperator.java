package ir;

/**
 * Binary operators, grouped by how they propagate zero values
 */
public enum BinaryOperator {
    ADD("+"), SUB("-"), MUL("*"), QUO("/"), REM("%"), AND("&"), OR("|"), XOR("^"), AND_NOT("&^"), SHL("<<"), SHR(">>"),
    EQL("=="), NEQ("!="), LSS("<"), LEQ("<="), GTR(">"), GEQ(">=");

    private final String symbol;

    private BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Find the operator for the given Go token
     *
     * @param symbol token, e.g. "&amp;^"
     * @return operator or null if the symbol is not a binary operator
     */
    public static BinaryOperator forSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return true for operators producing a boolean
     */
    public boolean isComparison() {
        switch (this) {
        case EQL:
        case NEQ:
        case LSS:
        case LEQ:
        case GTR:
        case GEQ:
            return true;
        default:
            return false;
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
