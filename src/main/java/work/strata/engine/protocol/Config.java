package work.strata.engine.protocol;

import java.util.Set;

/**
 * Runtime settings read from the {@code $config} record.
 *
 * @param floatPrecision digits after the decimal point when rendering floats, -1 for the shortest form
 * @param parallelWorkers worker threads used by {@code par-each}
 * @param listSeparator separator used when a list is rendered into a single string
 */
public record Config(int floatPrecision, int parallelWorkers, String listSeparator) {
    private static final Set<String> KNOWN_KEYS = Set.of("float_precision", "parallel_workers", "list_separator");

    public Config {
        if (parallelWorkers < 1) {
            throw new IllegalArgumentException("parallelWorkers must be >= 1");
        }
        if (listSeparator == null) {
            listSeparator = ", ";
        }
    }

    public static Config defaults() {
        return new Config(-1, Math.max(1, Runtime.getRuntime().availableProcessors()), ", ");
    }

    /**
     * Reads known keys from a record; unknown keys are ignored and missing keys keep their defaults.
     */
    public static Config fromValue(Value value) {
        if (!(value instanceof Value.Record record)) {
            throw ShellError.unsupportedConfigValue("record", value.typeName(), value.span());
        }
        var config = defaults();
        int precision = config.floatPrecision();
        int workers = config.parallelWorkers();
        String separator = config.listSeparator();
        for (int i = 0; i < record.cols().size(); i++) {
            var key = record.cols().get(i);
            var val = record.vals().get(i);
            if (val instanceof Value.Nothing && KNOWN_KEYS.contains(key)) {
                throw ShellError.missingConfigValue(key, val.span());
            }
            switch (key) {
                case "float_precision":
                    precision = (int) expectInt(val);
                    break;
                case "parallel_workers":
                    long requested = expectInt(val);
                    if (requested < 1) {
                        throw ShellError.unsupportedConfigValue("positive int", Long.toString(requested), val.span());
                    }
                    workers = (int) Math.min(requested, 1024);
                    break;
                case "list_separator":
                    if (!(val instanceof Value.Str str)) {
                        throw ShellError.unsupportedConfigValue("string", val.typeName(), val.span());
                    }
                    separator = str.val();
                    break;
                default:
                    break;
            }
        }
        return new Config(precision, workers, separator);
    }

    private static long expectInt(Value val) {
        if (val instanceof Value.Int integer) {
            return integer.val();
        }
        throw ShellError.unsupportedConfigValue("int", val.typeName(), val.span());
    }
}
