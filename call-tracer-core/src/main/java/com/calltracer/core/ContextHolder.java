package com.calltracer.core;

import java.util.concurrent.Callable;

/**
 * Thread-local slot for the current {@link CallContext}, for code that cannot pass the
 * context as a parameter (instrumentation agents, framework callbacks).
 *
 * Contexts do not follow work onto other threads by themselves: wrap tasks with
 * {@link #wrap(Runnable)} / {@link #wrap(Callable)} before handing them to an executor.
 */
public final class ContextHolder {

    private ContextHolder() {}

    private static final ThreadLocal<CallContext> current = new ThreadLocal<>();

    /** Context attached to the current thread, or null. */
    public static CallContext current() {
        return current.get();
    }

    /** Attaches {@code context} to the current thread until the returned scope is closed. */
    public static Scope attach(CallContext context) {
        CallContext previous = current.get();
        current.set(context);
        return new Scope(previous);
    }

    public static Runnable wrap(Runnable task) {
        CallContext captured = current.get();
        return () -> {
            try (Scope ignored = attach(captured)) {
                task.run();
            }
        };
    }

    public static <V> Callable<V> wrap(Callable<V> task) {
        CallContext captured = current.get();
        return () -> {
            try (Scope ignored = attach(captured)) {
                return task.call();
            }
        };
    }

    /** Restores the previously attached context on close. */
    public static final class Scope implements AutoCloseable {
        private final CallContext previous;

        private Scope(CallContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
