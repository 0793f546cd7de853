package com.calltracer.core;

/**
 * Process-wide tracing API backed by a single lazily created {@link Telemetry}.
 */
public final class Tracing {

    private Tracing() {}

    private static final class Holder {
        static final Telemetry INSTANCE = new Telemetry();
    }

    public static Telemetry instance() {
        return Holder.INSTANCE;
    }

    /** Starts tracing; the method calling this one becomes the tree's root. */
    public static void enable() {
        instance().enable();
    }

    public static void disable() {
        instance().disable();
    }

    public static void clear() {
        instance().clear();
    }

    public static boolean isEnabled() {
        return instance().isEnabled();
    }

    public static String getMetricsJson() {
        return instance().exportJson();
    }

    public static String getRoot() {
        return instance().getRoot();
    }

    public static CallContext seed() {
        return instance().seed();
    }

    public static CallContext derive(CallContext parent) {
        return instance().derive(parent);
    }

    public static Span start(CallContext parent) {
        return instance().start(parent);
    }

    public static Span start(CallContext parent, String functionName) {
        return instance().start(parent, functionName);
    }

    public static void observe(CallContext context, long startNanos) {
        instance().observe(context, startNanos);
    }
}
