package com.calltracer.core.metrics;

import java.time.Instant;

/** Kinds of value a {@link MetricStore} entry can hold. */
public enum MetricType {
    INVALID("InvalidMetric"),
    COUNTER("Counter"),
    FRACTION("Fraction"),
    STRING("String"),
    TIME("Time");

    private final String label;

    MetricType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Type of a stored (already normalized) value; INVALID for null or foreign classes. */
    static MetricType of(Object value) {
        if (value instanceof Long) return COUNTER;
        if (value instanceof Double) return FRACTION;
        if (value instanceof String) return STRING;
        if (value instanceof Instant) return TIME;
        return INVALID;
    }
}
