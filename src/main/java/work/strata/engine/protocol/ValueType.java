package work.strata.engine.protocol;

/**
 * Runtime type tags, rendered in diagnostics ("Input's type is int").
 */
public enum ValueType {
    NOTHING("nothing"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BINARY("binary"),
    RECORD("record"),
    LIST("list"),
    RANGE("range"),
    ERROR("error"),
    BLOCK("block");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
