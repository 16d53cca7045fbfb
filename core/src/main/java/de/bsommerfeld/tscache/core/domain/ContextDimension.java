package de.bsommerfeld.tscache.core.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single {@code context(key:value)} constraint of a slice, e.g.
 * {@code channel:google}.
 *
 * @param key   the context dimension name
 * @param value the selected value of that dimension
 */
public record ContextDimension(String key, String value) implements Comparable<ContextDimension> {

    private static final Comparator<ContextDimension> ORDER = Comparator
            .comparing(ContextDimension::key)
            .thenComparing(ContextDimension::value);

    public ContextDimension {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (key.isBlank())
            throw new IllegalArgumentException("Context key must not be blank");
    }

    /** Renders the dimension as a DSL clause: {@code context(key:value)}. */
    public String toClause() {
        return "context(" + key + ":" + value + ")";
    }

    @Override
    public int compareTo(ContextDimension other) {
        return ORDER.compare(this, other);
    }
}
