package com.calltracer.core.metrics;

/**
 * Base of the errors raised by {@link MetricStore}.
 */
public class MetricException extends RuntimeException {

    public MetricException(String message) { super(message); }

    public static class MetricNotFound extends MetricException {
        public MetricNotFound(String name) {
            super(String.format("Metric was not found | name=%s |", name));
        }
    }

    public static class CounterNotFound extends MetricException {
        public CounterNotFound(String name) {
            super(String.format("Counter was not found | name=%s |", name));
        }
    }

    /** The value passed does not match the type of the stored metric. */
    public static class TypeMismatch extends MetricException {
        public TypeMismatch(String name, MetricType type) {
            super(String.format("Metric does not match with value to update | name=%s, type=%s |",
                name, type.label()));
        }
    }

    public static class UnsupportedOperation extends MetricException {
        public UnsupportedOperation(String name, MetricType type, String operation) {
            super(String.format("Metric does not support operation | name=%s, type=%s, operation=%s |",
                name, type.label(), operation));
        }
    }

    /** A value could not be read as, or converted to, the expected kind. */
    public static class ValueAssertion extends MetricException {
        public ValueAssertion(Object value, String expectedType) {
            super(String.format("Metric data could not be asserted | value=%s, type=%s |",
                value, expectedType));
        }
    }
}
