package io.stubmatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * A single decoded HTTP-like request, the input of every expectation check.
 *
 * <p>
 * Instances are immutable. They are produced by {@link #parse(String)}, by
 * the copy-on-write {@code with*} methods, or by a {@link Builder}.
 *
 * <ul>
 * <li>{@code method} is stored verbatim (matching compares it ignoring
 * case).
 * <li>{@code path} always starts with {@code /} and is never empty.
 * <li>{@code fragment} is absent rather than empty.
 * <li>{@code headers} are exact-match: no case folding of names or values.
 * </ul>
 *
 * <p>
 * {@link #toString()} is the canonical single-line rendering used in
 * diagnostics, e.g.
 * {@code [POST /users?page=2&debug#top | with headers {"Accept" = "json"} | with body "{}"]}.
 */
public record Request(
        String method,
        String path,
        QueryParams query,
        Optional<String> fragment,
        Map<String, String> headers,
        Optional<String> body) {

    public static final String DEFAULT_METHOD = "GET";
    public static final String ROOT_PATH = "/";

    private static final Request DEFAULTS = new Request(
            DEFAULT_METHOD, ROOT_PATH, QueryParams.empty(), Optional.empty(), Map.of(), Optional.empty());

    /**
     * Canonical constructor with normalization.
     *
     * @param method   the request method; null falls back to {@code GET}
     * @param path     the request path; null or empty becomes {@code /}, a
     *                 missing leading slash is added
     * @param query    the query parameters; null becomes empty
     * @param fragment the fragment; null or an empty string becomes absent
     * @param headers  exact-match headers; null becomes empty, insertion
     *                 order is kept for rendering, null names or values
     *                 are rejected
     * @param body     the body; null becomes absent
     */
    public Request {
        method = method != null ? method : DEFAULT_METHOD;
        path = normalizePath(path);
        query = query != null ? query : QueryParams.empty();
        fragment = fragment != null ? fragment.filter(f -> !f.isEmpty()) : Optional.empty();
        headers = headers != null && !headers.isEmpty() ? copyHeaders(headers) : Map.of();
        body = body != null ? body : Optional.empty();
    }

    /** The default request: {@code GET /}, nothing else. */
    public static Request defaults() {
        return DEFAULTS;
    }

    /**
     * Parses a URI-like string such as {@code /path?key=value&flag#anchor}.
     * Never fails; see {@link RequestParser}.
     */
    public static Request parse(String text) {
        return RequestParser.parse(text);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a mutable builder pre-populated with this request's fields. */
    public Builder toBuilder() {
        return new Builder(this);
    }

    private static Map<String, String> copyHeaders(Map<String, String> headers) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        headers.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "header name must not be null"),
                Objects.requireNonNull(value, "header value must not be null")));
        return Collections.unmodifiableMap(copy);
    }

    static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return ROOT_PATH;
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    // ── Convenience accessors ──

    /** The value of a header, or empty if the header is absent. */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name);
    }

    // ── Copy-on-write ──

    public Request withMethod(String method) {
        Objects.requireNonNull(method, "method must not be null");
        return new Request(method, path, query, fragment, headers, body);
    }

    public Request withPath(String path) {
        Objects.requireNonNull(path, "path must not be null");
        return new Request(method, path, query, fragment, headers, body);
    }

    /** Returns a copy with {@code key=value} added to (or replaced in) the query. */
    public Request withQuery(String key, String value) {
        return new Request(method, path, query.with(key, value), fragment, headers, body);
    }

    /** Returns a copy with {@code key} added to the query as a flag (no value). */
    public Request withQueryFlag(String key) {
        return new Request(method, path, query.withFlag(key), fragment, headers, body);
    }

    public Request withQuery(QueryParams query) {
        Objects.requireNonNull(query, "query must not be null");
        return new Request(method, path, query, fragment, headers, body);
    }

    public Request withFragment(String fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null; use withoutFragment()");
        return new Request(method, path, query, Optional.of(fragment), headers, body);
    }

    public Request withoutFragment() {
        return new Request(method, path, query, Optional.empty(), headers, body);
    }

    /** Returns a copy with the header set, replacing any previous value under the exact same name. */
    public Request withHeader(String name, String value) {
        Objects.requireNonNull(name, "header name must not be null");
        Objects.requireNonNull(value, "header value must not be null");
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new Request(method, path, query, fragment, copy, body);
    }

    public Request withHeaders(Map<String, String> headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        return new Request(method, path, query, fragment, headers, body);
    }

    public Request withBody(String body) {
        Objects.requireNonNull(body, "body must not be null; use withoutBody()");
        return new Request(method, path, query, fragment, headers, Optional.of(body));
    }

    public Request withoutBody() {
        return new Request(method, path, query, fragment, headers, Optional.empty());
    }

    // ── Rendering ──

    /**
     * Canonical single-line rendering:
     * {@code [METHOD PATH[?query][#fragment][ | with headers {...}][ | with body "..."]]}.
     * Stable across runs; header and query order follow insertion order.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(method).append(' ').append(path);
        if (!query.isEmpty()) {
            sb.append('?').append(query.render());
        }
        fragment.ifPresent(f -> sb.append('#').append(f));
        if (!headers.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            headers.forEach((name, value) -> joiner.add(quote(name) + " = " + quote(value)));
            sb.append(" | with headers ").append(joiner);
        }
        body.ifPresent(b -> sb.append(" | with body ").append(quote(b)));
        return sb.append(']').toString();
    }

    /**
     * Double-quotes a value, escaping backslash, quote, CR, LF and TAB so the
     * result stays on one line. Shared by request rendering and rule
     * descriptions.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Mutable builder for {@link Request}. Every setter changes exactly one
     * field. Not thread-safe; build once, then share the immutable result.
     */
    public static final class Builder {
        private String method = DEFAULT_METHOD;
        private String path = ROOT_PATH;
        private QueryParams query = QueryParams.empty();
        private String fragment;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;

        Builder() {}

        Builder(Request request) {
            this.method = request.method();
            this.path = request.path();
            this.query = request.query();
            this.fragment = request.fragment().orElse(null);
            this.headers.putAll(request.headers());
            this.body = request.body().orElse(null);
        }

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method must not be null");
            return this;
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path must not be null");
            return this;
        }

        public Builder query(String key, String value) {
            this.query = query.with(key, value);
            return this;
        }

        public Builder queryFlag(String key) {
            this.query = query.withFlag(key);
            return this;
        }

        public Builder removeQuery(String key) {
            this.query = query.without(key);
            return this;
        }

        /** Sets the fragment; {@code null} clears it. */
        public Builder fragment(String fragment) {
            this.fragment = fragment;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(
                    Objects.requireNonNull(name, "header name must not be null"),
                    Objects.requireNonNull(value, "header value must not be null"));
            return this;
        }

        public Builder removeHeader(String name) {
            headers.remove(name);
            return this;
        }

        /** Sets the body; {@code null} clears it. */
        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Request build() {
            return new Request(
                    method, path, query, Optional.ofNullable(fragment), headers, Optional.ofNullable(body));
        }
    }
}
