package io.stubmatch.core.error;

/**
 * Abstract base for all stubmatch exceptions. Never thrown directly.
 *
 * <p>
 * Request mismatches are not exceptions: they are reported as data by
 * {@link io.stubmatch.core.matcher.Expectations}. Exceptions are reserved
 * for malformed input to the library itself.
 */
public abstract class StubMatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected StubMatchException(String message) {
        super(message);
    }

    protected StubMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
