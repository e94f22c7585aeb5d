package io.stubmatch.core.error;

/** Thrown when an expectation document has invalid syntax, an unknown key or an invalid rule. */
public final class ExpectationParseException extends StubMatchException {

    private static final long serialVersionUID = 1L;

    /** Marker for errors that concern the document as a whole rather than one rule. */
    public static final int DOCUMENT = -1;

    private final String source;
    private final int index;

    public ExpectationParseException(String message, String source, int index) {
        super(message);
        this.source = source;
        this.index = index;
    }

    public ExpectationParseException(String message, Throwable cause, String source, int index) {
        super(message, cause);
        this.source = source;
        this.index = index;
    }

    /** The file path, or {@code "<inline>"} for documents parsed from a string. */
    public String source() {
        return source;
    }

    /** Zero-based index of the offending rule, or {@link #DOCUMENT}. */
    public int index() {
        return index;
    }
}
