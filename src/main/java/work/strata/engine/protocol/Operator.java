package work.strata.engine.protocol;

public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("mod"),
    POW("**"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    AND("&&"),
    OR("||"),
    IN("in"),
    NOT_IN("not-in"),
    CONTAINS("=~"),
    NOT_CONTAINS("!~");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isShortCircuit() {
        return this == AND || this == OR;
    }
}
