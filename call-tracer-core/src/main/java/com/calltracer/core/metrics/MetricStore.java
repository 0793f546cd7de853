package com.calltracer.core.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Named, typed metrics: counters (long), fractions (double), strings and timestamps.
 *
 * Independent of the call tracer. A metric's type follows its current value: integral numbers
 * are stored as {@code Long}, floating point numbers as {@code Double}. A reset metric keeps
 * its name but holds no value (and no type) until it is set again.
 */
public class MetricStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Object> metrics = new LinkedHashMap<>();

    public MetricStore() {}

    /** Creates a store holding the given metrics and initial values. */
    public MetricStore(Map<String, ?> initial) {
        initial.forEach(this::add);
    }

    /** Adds (or replaces) a metric. A null initial value leaves the metric untyped. */
    public void add(String name, Object initialValue) {
        Object value = initialValue == null ? null : requireSupported(initialValue);
        lock.writeLock().lock();
        try {
            metrics.put(name, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Removes a metric; does nothing if it does not exist. */
    public void delete(String name) {
        lock.writeLock().lock();
        try {
            metrics.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Updates
    // -----------------------------------------------------------------------

    /**
     * Adds {@code increment} to a counter or fraction, or appends it to a string.
     *
     * @throws MetricException.MetricNotFound if the metric does not exist or holds no value
     * @throws MetricException.TypeMismatch if {@code increment} is not of the metric's type
     * @throws MetricException.UnsupportedOperation for timestamps
     */
    public void increase(String name, Object increment) {
        lock.writeLock().lock();
        try {
            Object current = requireValue(name);
            Object delta = normalize(increment);
            MetricType type = MetricType.of(current);
            switch (type) {
                case COUNTER -> metrics.put(name, (Long) current + (Long) requireType(name, type, delta));
                case FRACTION -> metrics.put(name, (Double) current + (Double) requireType(name, type, delta));
                case STRING -> metrics.put(name, current + (String) requireType(name, type, delta));
                case TIME -> throw new MetricException.UnsupportedOperation(name, type, "increase");
                default -> throw new MetricException.MetricNotFound(name);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Subtracts {@code decrement} from a counter or fraction.
     *
     * @throws MetricException.MetricNotFound if the metric does not exist or holds no value
     * @throws MetricException.TypeMismatch if {@code decrement} is not of the metric's type
     * @throws MetricException.UnsupportedOperation for strings and timestamps
     */
    public void decrease(String name, Object decrement) {
        lock.writeLock().lock();
        try {
            Object current = requireValue(name);
            Object delta = normalize(decrement);
            MetricType type = MetricType.of(current);
            switch (type) {
                case COUNTER -> metrics.put(name, (Long) current - (Long) requireType(name, type, delta));
                case FRACTION -> metrics.put(name, (Double) current - (Double) requireType(name, type, delta));
                case STRING, TIME -> throw new MetricException.UnsupportedOperation(name, type, "decrease");
                default -> throw new MetricException.MetricNotFound(name);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Replaces the value of an existing metric; its type follows the new value. */
    public void set(String name, Object value) {
        Object normalized = value == null ? null : requireSupported(value);
        lock.writeLock().lock();
        try {
            if (!metrics.containsKey(name)) {
                throw new MetricException.MetricNotFound(name);
            }
            metrics.put(name, normalized);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Clears the value of one metric. */
    public void reset(String name) {
        lock.writeLock().lock();
        try {
            if (!metrics.containsKey(name)) {
                throw new MetricException.MetricNotFound(name);
            }
            metrics.put(name, null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Clears the value of every metric, keeping the names. */
    public void resetAll() {
        lock.writeLock().lock();
        try {
            metrics.replaceAll((name, value) -> null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Reads
    // -----------------------------------------------------------------------

    /** Current value, null if the metric was reset. */
    public Object get(String name) {
        lock.readLock().lock();
        try {
            if (!metrics.containsKey(name)) {
                throw new MetricException.MetricNotFound(name);
            }
            return metrics.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public double getAsDouble(String name) {
        Object value = get(name);
        if (!(value instanceof Double d)) {
            throw new MetricException.ValueAssertion(value, MetricType.FRACTION.label());
        }
        return d;
    }

    public long getCounter(String name) {
        lock.readLock().lock();
        try {
            if (!(metrics.get(name) instanceof Long counter)) {
                throw new MetricException.CounterNotFound(name);
            }
            return counter;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Type of the current value; INVALID if the metric does not exist or was reset. */
    public MetricType getType(String name) {
        lock.readLock().lock();
        try {
            return MetricType.of(metrics.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Metric names in alphabetical order. */
    public List<String> names() {
        lock.readLock().lock();
        try {
            List<String> names = new ArrayList<>(metrics.keySet());
            Collections.sort(names);
            return names;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of every metric and its current value. */
    public Map<String, Object> getAll() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        } finally {
            lock.readLock().unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private Object requireValue(String name) {
        Object current = metrics.get(name);
        if (current == null) {
            throw new MetricException.MetricNotFound(name);
        }
        return current;
    }

    private static Object requireType(String name, MetricType type, Object value) {
        if (MetricType.of(value) != type) {
            throw new MetricException.TypeMismatch(name, type);
        }
        return value;
    }

    private static Object requireSupported(Object value) {
        Object normalized = normalize(value);
        if (MetricType.of(normalized) == MetricType.INVALID) {
            throw new MetricException.ValueAssertion(value, "Counter|Fraction|String|Time");
        }
        return normalized;
    }

    /** Widens boxed integral types to Long and floating types to Double; other values pass through. */
    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }
}
