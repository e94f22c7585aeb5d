package io.stubmatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Ordered query-parameter collection of a {@link Request}.
 *
 * <p>
 * Every key maps to an explicit optional value. A key written without
 * {@code =value} (e.g. {@code ?debug}) is a <em>flag</em>: it is present but
 * carries no value. A flag is never confused with an absent key:
 * {@link #contains(String)} is {@code true} for both flags and key/value
 * pairs, {@link #value(String)} is non-empty only for pairs.
 *
 * <p>
 * Keys are unique and kept in insertion order; re-setting a key replaces its
 * value but keeps its position. The class is immutable, so "mutations"
 * return new instances.
 */
public final class QueryParams {

    private static final QueryParams EMPTY = new QueryParams(new LinkedHashMap<>());

    /** Internal storage: insertion order, flags map to {@code Optional.empty()}. */
    private final LinkedHashMap<String, Optional<String>> store;

    private QueryParams(LinkedHashMap<String, Optional<String>> store) {
        this.store = store;
    }

    /** Returns an empty collection. */
    public static QueryParams empty() {
        return EMPTY;
    }

    /**
     * Creates a collection from an ordered map of key to optional value.
     *
     * @param entries key to value; {@code Optional.empty()} marks a flag
     * @return immutable {@code QueryParams}
     */
    public static QueryParams of(Map<String, Optional<String>> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, Optional<String>> copy = new LinkedHashMap<>();
        entries.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "query key must not be null"),
                Objects.requireNonNull(value, "query value must not be null; use Optional.empty() for flags")));
        return new QueryParams(copy);
    }

    /** True if the key is present, with or without a value. */
    public boolean contains(String key) {
        return store.containsKey(key);
    }

    /**
     * The value of a key.
     *
     * @return the value, or empty if the key is absent <em>or</em> a flag; use
     *         {@link #contains(String)} to tell the two apart
     */
    public Optional<String> value(String key) {
        Optional<String> value = store.get(key);
        return value != null ? value : Optional.empty();
    }

    /** True if the key is present without a value. */
    public boolean isFlag(String key) {
        Optional<String> value = store.get(key);
        return value != null && value.isEmpty();
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public int size() {
        return store.size();
    }

    /** Keys in insertion order. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(store.keySet());
    }

    /** Unmodifiable ordered view of key to optional value. */
    public Map<String, Optional<String>> asMap() {
        return Collections.unmodifiableMap(store);
    }

    /** Returns a copy with {@code key=value} set. */
    public QueryParams with(String key, String value) {
        Objects.requireNonNull(value, "query value must not be null; use withFlag() for keys without a value");
        return put(key, Optional.of(value));
    }

    /** Returns a copy with {@code key} set as a flag (no value). */
    public QueryParams withFlag(String key) {
        return put(key, Optional.empty());
    }

    /** Returns a copy without {@code key}. */
    public QueryParams without(String key) {
        if (!store.containsKey(key)) {
            return this;
        }
        LinkedHashMap<String, Optional<String>> copy = new LinkedHashMap<>(store);
        copy.remove(key);
        return copy.isEmpty() ? EMPTY : new QueryParams(copy);
    }

    private QueryParams put(String key, Optional<String> value) {
        Objects.requireNonNull(key, "query key must not be null");
        LinkedHashMap<String, Optional<String>> copy = new LinkedHashMap<>(store);
        copy.put(key, value);
        return new QueryParams(copy);
    }

    /** Renders {@code key=value} and bare {@code key} entries joined by {@code &}. */
    public String render() {
        StringJoiner joiner = new StringJoiner("&");
        store.forEach((key, value) -> joiner.add(value.map(v -> key + "=" + v).orElse(key)));
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryParams that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParams[" + render() + "]";
    }
}
