package work.strata.engine.formats;

import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;

/**
 * Turns text in some data format into a structured value. Failures are reported as
 * {@link work.strata.engine.protocol.ShellError}s anchored at {@code span}.
 */
@FunctionalInterface
public interface FormatDecoder {
    Value decode(String text, Span span);
}
