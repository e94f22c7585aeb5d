package io.stubmatch.core.matcher;

import io.stubmatch.core.model.Request;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of {@link Expectation} rules evaluated together against a
 * {@link Request}.
 *
 * <p>
 * Every rule is always evaluated, even after the first failure, and
 * diagnostics come back in the order the rules were added. Rules are never
 * de-duplicated or reordered.
 *
 * <p>
 * Immutable: {@link #with(Expectation)} and {@link #withAll(List)} return a
 * new instance and leave the receiver untouched. Thread-safe.
 */
public final class Expectations implements Iterable<Expectation> {

    private static final Logger LOG = LoggerFactory.getLogger(Expectations.class);

    private static final Expectations EMPTY = new Expectations(List.of());

    private final List<Expectation> rules;

    private Expectations(List<Expectation> rules) {
        this.rules = rules;
    }

    public static Expectations empty() {
        return EMPTY;
    }

    public static Expectations of(Expectation... rules) {
        return of(List.of(rules));
    }

    /**
     * Creates an aggregator over the given rules, in order.
     *
     * @param rules the rules; must not contain {@code null}
     * @return immutable {@code Expectations}
     */
    public static Expectations of(List<? extends Expectation> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        return rules.isEmpty() ? EMPTY : new Expectations(List.copyOf(rules));
    }

    /** Returns a new instance with {@code rule} appended after the existing rules. */
    public Expectations with(Expectation rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        List<Expectation> copy = new ArrayList<>(rules.size() + 1);
        copy.addAll(rules);
        copy.add(rule);
        return new Expectations(Collections.unmodifiableList(copy));
    }

    /** Returns a new instance with {@code more} appended, in order, after the existing rules. */
    public Expectations withAll(List<? extends Expectation> more) {
        Objects.requireNonNull(more, "rules must not be null");
        if (more.isEmpty()) {
            return this;
        }
        List<Expectation> copy = new ArrayList<>(rules.size() + more.size());
        copy.addAll(rules);
        copy.addAll(List.copyOf(more));
        return new Expectations(Collections.unmodifiableList(copy));
    }

    /** The rules in insertion order. */
    public List<Expectation> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public Iterator<Expectation> iterator() {
        return rules.iterator();
    }

    /**
     * True iff every rule is satisfied. Always equal to
     * {@code validate(request).isEmpty()}.
     */
    public boolean isMatched(Request request) {
        Objects.requireNonNull(request, "request must not be null");
        for (Expectation rule : rules) {
            if (rule.validate(request).isPresent()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluates every rule and collects the diagnostics of the failing ones.
     *
     * @param request the request to check
     * @return empty if all rules pass, otherwise the observed-state variants
     *         in rule order
     */
    public Optional<List<Expectation>> validate(Request request) {
        List<Mismatch> mismatches = explain(request);
        if (mismatches.isEmpty()) {
            return Optional.empty();
        }
        List<Expectation> diagnostics = new ArrayList<>(mismatches.size());
        for (Mismatch mismatch : mismatches) {
            diagnostics.add(mismatch.actual());
        }
        return Optional.of(Collections.unmodifiableList(diagnostics));
    }

    /**
     * Like {@link #validate(Request)} but keeps each failing rule next to its
     * diagnostic.
     *
     * @return failing rules in rule order, empty if the request matches
     */
    public List<Mismatch> explain(Request request) {
        Objects.requireNonNull(request, "request must not be null");
        List<Mismatch> mismatches = new ArrayList<>();
        for (Expectation rule : rules) {
            rule.validate(request).ifPresent(actual -> mismatches.add(new Mismatch(rule, actual)));
        }
        if (!mismatches.isEmpty() && LOG.isDebugEnabled()) {
            LOG.debug("Request {} failed {} of {} expectations", request, mismatches.size(), rules.size());
        }
        return Collections.unmodifiableList(mismatches);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expectations that)) return false;
        return rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "Expectations" + rules;
    }
}
