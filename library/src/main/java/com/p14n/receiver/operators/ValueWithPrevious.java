package com.p14n.receiver.operators;

import java.util.Objects;
import java.util.Optional;

/**
 * A value together with the value observed before it, as produced by
 * {@link Operators#withPrevious}.
 *
 * @param previous The preceding value, empty for the first value observed
 * @param current  The value just observed
 */
public record ValueWithPrevious<V>(Optional<V> previous, V current) {

    public ValueWithPrevious {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
    }

    static <V> ValueWithPrevious<V> first(V current) {
        return new ValueWithPrevious<>(Optional.empty(), current);
    }

    static <V> ValueWithPrevious<V> following(V previous, V current) {
        return new ValueWithPrevious<>(Optional.of(previous), current);
    }
}
