package com.questrail.keycode.protocol.model;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Explicit set of accepted values, written unchanged.
 */
public record EnumeratedValues(SortedSet<Long> values) implements FieldDomain
{
    public EnumeratedValues {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        if (values.first() < 0) {
            throw new IllegalArgumentException("values must be non-negative");
        }
        values = Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    public static EnumeratedValues of(long... values) {
        return new EnumeratedValues(LongStream.of(values).boxed()
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    /**
     * Values of the inclusive range {@code [from, to]} plus any {@code extra} values.
     */
    public static EnumeratedValues rangeAnd(long from, long to, long... extra) {
        return new EnumeratedValues(LongStream.concat(LongStream.rangeClosed(from, to), LongStream.of(extra))
                .boxed()
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    @Override
    public boolean contains(long value) {
        return values.contains(value);
    }

    @Override
    public long toEncoded(long value) {
        return value;
    }

    @Override
    public long maxEncoded() {
        return values.last();
    }

    @Override
    public String describe() {
        if (values.size() <= 8) {
            return "expected one of " + values;
        }
        return "expected one of " + values.size() + " values between "
                + values.first() + " and " + values.last();
    }
}
