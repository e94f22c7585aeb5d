package io.stubmatch.core.matcher;

import static io.stubmatch.core.model.Request.quote;

import io.stubmatch.core.model.Request;
import java.util.Objects;
import java.util.Optional;

/**
 * A single rule a {@link Request} is expected to satisfy.
 *
 * <p>
 * The hierarchy is sealed and doubles as the diagnostic type:
 * {@link #validate(Request)} returns, on mismatch, the variant that
 * <em>would</em> have matched, describing what was actually observed. Feeding
 * that diagnostic back into {@code validate} against the same request always
 * succeeds.
 *
 * <p>
 * Existence rules ({@code *Exists}, {@code *Miss}) only test presence.
 * Equality rules ({@code *Eq}) test content; a query key present without a
 * value fails {@link QueryEq} and is reported as {@link QueryExists}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Expectation {

    /**
     * Checks this rule against a request.
     *
     * @param request the request to check
     * @return empty if satisfied, otherwise the variant describing the observed
     *         state
     */
    Optional<Expectation> validate(Request request);

    /** One-line human description, e.g. {@code query "page" is "2"}. */
    String describe();

    // ── Method / path ──

    /** Method equals {@code expected}, ignoring case. Diagnostics report the method verbatim. */
    record Method(String expected) implements Expectation {
        public Method {
            Objects.requireNonNull(expected, "expected method must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (request.method().equalsIgnoreCase(expected)) {
                return Optional.empty();
            }
            return Optional.of(new Method(request.method()));
        }

        @Override
        public String describe() {
            return "method is " + quote(expected);
        }
    }

    /** Path equals {@code expected} exactly (case-sensitive). */
    record Path(String expected) implements Expectation {
        public Path {
            Objects.requireNonNull(expected, "expected path must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (request.path().equals(expected)) {
                return Optional.empty();
            }
            return Optional.of(new Path(request.path()));
        }

        @Override
        public String describe() {
            return "path is " + quote(expected);
        }
    }

    // ── Query ──

    /** Query key is present, with or without a value. */
    record QueryExists(String key) implements Expectation {
        public QueryExists {
            Objects.requireNonNull(key, "query key must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (request.query().contains(key)) {
                return Optional.empty();
            }
            return Optional.of(new QueryMiss(key));
        }

        @Override
        public String describe() {
            return "query " + quote(key) + " is present";
        }
    }

    /** Query key is absent. */
    record QueryMiss(String key) implements Expectation {
        public QueryMiss {
            Objects.requireNonNull(key, "query key must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (!request.query().contains(key)) {
                return Optional.empty();
            }
            return Optional.of(new QueryExists(key));
        }

        @Override
        public String describe() {
            return "query " + quote(key) + " is absent";
        }
    }

    /** Query key is present with exactly {@code expectedValue}. */
    record QueryEq(String key, String expectedValue) implements Expectation {
        public QueryEq {
            Objects.requireNonNull(key, "query key must not be null");
            Objects.requireNonNull(expectedValue, "expected query value must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (!request.query().contains(key)) {
                return Optional.of(new QueryMiss(key));
            }
            Optional<String> actual = request.query().value(key);
            if (actual.isEmpty()) {
                // present as a flag
                return Optional.of(new QueryExists(key));
            }
            return actual.filter(value -> !value.equals(expectedValue))
                    .<Expectation>map(value -> new QueryEq(key, value));
        }

        @Override
        public String describe() {
            return "query " + quote(key) + " is " + quote(expectedValue);
        }
    }

    // ── Fragment ──

    /** Fragment is present and equals {@code expected}. */
    record FragmentEq(String expected) implements Expectation {
        public FragmentEq {
            Objects.requireNonNull(expected, "expected fragment must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            Optional<String> actual = request.fragment();
            if (actual.isEmpty()) {
                return Optional.of(new FragmentMiss());
            }
            return actual.filter(fragment -> !fragment.equals(expected)).<Expectation>map(FragmentEq::new);
        }

        @Override
        public String describe() {
            return "fragment is " + quote(expected);
        }
    }

    /** Fragment is absent. */
    record FragmentMiss() implements Expectation {
        @Override
        public Optional<Expectation> validate(Request request) {
            return request.fragment().<Expectation>map(FragmentEq::new);
        }

        @Override
        public String describe() {
            return "fragment is absent";
        }
    }

    // ── Headers ──

    /** Header is present (exact-case name). */
    record HeaderExists(String key) implements Expectation {
        public HeaderExists {
            Objects.requireNonNull(key, "header name must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (request.hasHeader(key)) {
                return Optional.empty();
            }
            return Optional.of(new HeaderMiss(key));
        }

        @Override
        public String describe() {
            return "header " + quote(key) + " is present";
        }
    }

    /** Header is absent (exact-case name). */
    record HeaderMiss(String key) implements Expectation {
        public HeaderMiss {
            Objects.requireNonNull(key, "header name must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            if (!request.hasHeader(key)) {
                return Optional.empty();
            }
            return Optional.of(new HeaderExists(key));
        }

        @Override
        public String describe() {
            return "header " + quote(key) + " is absent";
        }
    }

    /** Header is present with exactly {@code expectedValue}. */
    record HeaderEq(String key, String expectedValue) implements Expectation {
        public HeaderEq {
            Objects.requireNonNull(key, "header name must not be null");
            Objects.requireNonNull(expectedValue, "expected header value must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            Optional<String> actual = request.header(key);
            if (actual.isEmpty()) {
                return Optional.of(new HeaderMiss(key));
            }
            return actual.filter(value -> !value.equals(expectedValue))
                    .<Expectation>map(value -> new HeaderEq(key, value));
        }

        @Override
        public String describe() {
            return "header " + quote(key) + " is " + quote(expectedValue);
        }
    }

    // ── Body ──

    /** Body is present and equals {@code expected}. */
    record BodyEq(String expected) implements Expectation {
        public BodyEq {
            Objects.requireNonNull(expected, "expected body must not be null");
        }

        @Override
        public Optional<Expectation> validate(Request request) {
            Optional<String> actual = request.body();
            if (actual.isEmpty()) {
                return Optional.of(new BodyMiss());
            }
            return actual.filter(body -> !body.equals(expected)).<Expectation>map(BodyEq::new);
        }

        @Override
        public String describe() {
            return "body is " + quote(expected);
        }
    }

    /** Body is absent. */
    record BodyMiss() implements Expectation {
        @Override
        public Optional<Expectation> validate(Request request) {
            return request.body().<Expectation>map(BodyEq::new);
        }

        @Override
        public String describe() {
            return "body is absent";
        }
    }
}
