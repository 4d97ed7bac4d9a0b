package com.arbor.tree;

/**
 * Half-open range {@code [from, to)} over interval endpoints. Either bound may be {@code null}
 * (unbounded on that side), but not both.
 */
public record IntervalRange(Long from, Long to) {

    public IntervalRange {
        if (from == null && to == null) {
            throw new MalformedShiftRequestException();
        }
    }

    public static IntervalRange of(Long from, Long to) {
        return new IntervalRange(from, to);
    }

    /** {@code [from, +inf)} */
    public static IntervalRange atLeast(long from) {
        return new IntervalRange(from, null);
    }

    /** {@code (-inf, to)} */
    public static IntervalRange below(long to) {
        return new IntervalRange(null, to);
    }

    public boolean contains(long value) {
        return (from == null || from <= value) && (to == null || value < to);
    }

    public boolean isEmpty() {
        return from != null && to != null && from >= to;
    }

    @Override
    public String toString() {
        return "[" + (from != null ? from : "-inf") + ", " + (to != null ? to : "+inf") + ")";
    }
}
