package io.stubmatch.core.matcher;

import java.util.Objects;

/**
 * A failed rule paired with the diagnostic it produced.
 *
 * @param expected the rule as configured
 * @param actual   the variant describing what the request actually carried;
 *                 {@code actual} always validates against that request
 */
public record Mismatch(Expectation expected, Expectation actual) {

    public Mismatch {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(actual, "actual must not be null");
    }

    /** E.g. {@code expected method is "POST" but method is "GET"}. */
    public String describe() {
        return "expected " + expected.describe() + " but " + actual.describe();
    }
}
