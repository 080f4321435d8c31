package work.strata.engine.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Renders a {@link ShellError} against its source text as plain, uncoloured text.
 */
public final class DiagnosticFormatter {
    private DiagnosticFormatter() {}

    public static String format(ShellError error, String source) {
        var out = new StringBuilder();
        out.append("error[").append(error.code()).append("]: ").append(error.getMessage()).append('\n');
        var bytes = source == null ? new byte[0] : source.getBytes(StandardCharsets.UTF_8);
        for (var label : error.labels()) {
            var span = label.span();
            if (span.isUnknown() || span.start() > bytes.length) {
                out.append("  = ").append(label.text()).append('\n');
                continue;
            }
            int lineStart = lineStart(bytes, span.start());
            int lineEnd = lineEnd(bytes, span.start());
            int lineNumber = lineNumber(bytes, span.start());
            int column = codePoints(bytes, lineStart, span.start()) + 1;
            int width = Math.max(1, codePoints(bytes, span.start(), Math.min(span.end(), lineEnd)));
            var gutter = Integer.toString(lineNumber);
            var pad = " ".repeat(gutter.length());
            out.append(pad).append("--> ").append(lineNumber).append(':').append(column).append('\n');
            out.append(pad).append(" |\n");
            out.append(gutter).append(" | ")
                .append(new String(Arrays.copyOfRange(bytes, lineStart, lineEnd), StandardCharsets.UTF_8))
                .append('\n');
            out.append(pad).append(" | ")
                .append(" ".repeat(column - 1))
                .append("^".repeat(width))
                .append(' ')
                .append(label.text())
                .append('\n');
        }
        error.help().ifPresent(help -> out.append("  help: ").append(help).append('\n'));
        return out.toString();
    }

    private static int lineStart(byte[] bytes, int offset) {
        int index = Math.min(offset, bytes.length);
        while (index > 0 && bytes[index - 1] != '\n') {
            index--;
        }
        return index;
    }

    private static int lineEnd(byte[] bytes, int offset) {
        int index = offset;
        while (index < bytes.length && bytes[index] != '\n') {
            index++;
        }
        return index;
    }

    private static int lineNumber(byte[] bytes, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int codePoints(byte[] bytes, int from, int to) {
        if (to <= from) {
            return 0;
        }
        var text = new String(bytes, from, to - from, StandardCharsets.UTF_8);
        return text.codePointCount(0, text.length());
    }
}
