package info.isaksson.erland.metatree.process;

import info.isaksson.erland.metatree.binding.ParseException;
import info.isaksson.erland.metatree.binding.UnparseException;

import java.util.Locale;

/**
 * Structured description of a failed external tool call.
 *
 * @param kind    what went wrong at the process level
 * @param type    error type reported by the tool (for {@link Kind#TOOL_ERROR}), else the kind's name
 * @param message human-readable detail
 * @param line    1-based source line the tool blamed, 0 when unknown
 */
public record ToolFailure(Kind kind, String type, String message, int line) {

    public enum Kind {
        /** The tool answered {@code {"ok": false, ...}}. */
        TOOL_ERROR,
        /** The tool exited with a non-zero status. */
        NON_ZERO_EXIT,
        /** The tool did not answer within the configured timeout and was killed. */
        TIMEOUT,
        /** stdout was not a well-formed response. */
        MALFORMED_OUTPUT,
        /** The process could not be started. */
        LAUNCH_FAILED,
        /** The calling thread was interrupted while waiting. */
        INTERRUPTED
    }

    public ToolFailure {
        if (kind == null) throw new IllegalArgumentException("kind is null");
        type = type == null || type.isBlank() ? kind.name().toLowerCase(Locale.ROOT) : type;
        message = message == null ? "" : message;
        line = Math.max(0, line);
    }

    public static ToolFailure of(Kind kind, String message) {
        return new ToolFailure(kind, null, message, 0);
    }

    public String describe() {
        return type + ": " + message;
    }

    public ParseException toParseException() {
        return new ParseException(line, 0, describe());
    }

    public UnparseException toUnparseException() {
        return new UnparseException(describe());
    }
}
