package io.github.jakubt4.starfix.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Engine output whose shape depends on input cardinality: a lone value when the input list
 * had exactly one element, a list otherwise. Consumers flatten it with {@link #asList()}.
 *
 * <p>Elements may be {@code null}; the engine uses that for entries it could not compute.
 */
public final class OneOrMany<T> {

    private final List<T> values;
    private final boolean single;

    private OneOrMany(final List<T> values, final boolean single) {
        this.values = values;
        this.single = single;
    }

    public static <T> OneOrMany<T> one(final T value) {
        return new OneOrMany<>(Collections.singletonList(value), true);
    }

    public static <T> OneOrMany<T> many(final List<T> values) {
        return new OneOrMany<>(Collections.unmodifiableList(new ArrayList<>(values)), false);
    }

    public List<T> asList() {
        return values;
    }

    @Override
    public String toString() {
        return single ? String.valueOf(values.get(0)) : values.toString();
    }
}
