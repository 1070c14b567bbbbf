package io.github.cyfko.prereq.core.exception;

/**
 * Exception thrown when a token sequence violates the prerequisite grammar.
 * <p>
 * The offending token span is reported through {@link #getOffset()} and {@link #getSpan()} so that
 * tooling can highlight it in the catalog text.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Unmatched parenthesis:</strong> {@code "CS 1331 and ("}</li>
 *   <li><strong>Dangling connective:</strong> {@code "CS 1331 or"}</li>
 *   <li><strong>Empty group:</strong> {@code "CS 1331 and ()"}</li>
 *   <li><strong>Misplaced grade clause:</strong> {@code "(CS 1331 or CS 1301) Minimum Grade of C"}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ParseException extends PrerequisiteException {

    private final int offset;
    private final String span;

    /**
     * Creates an exception that is not tied to a particular token (e.g. input too long).
     *
     * @param message the message describing the grammar violation
     */
    public ParseException(String message) {
        this(message, -1, "");
    }

    /**
     * @param message the message describing the grammar violation
     * @param offset  offset of the offending token, or {@code -1} at end of input
     * @param span    the raw text of the offending token
     */
    public ParseException(String message, int offset, String span) {
        super(offset < 0 ? message : message + " at offset " + offset + " ('" + span + "')");
        this.offset = offset;
        this.span = span == null ? "" : span;
    }

    /**
     * @return offset of the offending token, {@code -1} when the error is at end of input or global
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return the raw text of the offending token, empty when unknown
     */
    public String getSpan() {
        return span;
    }
}
