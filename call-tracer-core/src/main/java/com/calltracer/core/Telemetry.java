package com.calltracer.core;

import com.google.gson.Gson;

/**
 * Tracing controller: lifecycle, per-call instrumentation entry points and JSON export.
 *
 * Owns one {@link CallAggregator}. Most hosts use the process-wide instance through
 * {@link Tracing}; tests and embedders that want isolated state construct their own.
 *
 * Instrumented code follows one pattern:
 * <pre>
 * void taskA(CallContext parent) {
 *     try (Span span = telemetry.start(parent)) {
 *         taskB(span.context());
 *     }
 * }
 * </pre>
 * Nothing here throws into the host: instrumentation must never abort the traced program.
 */
public class Telemetry {

    static final String EXPORT_ERROR_JSON = "{\"error\": \"Could not marshal the telemetry metrics\"}";

    private final CallAggregator aggregator;
    private final IdentityPropagator propagator;
    private final Gson gson;

    // Read without synchronization: a reader may act on a stale value for one
    // instrumentation cycle, the aggregator stays consistent either way.
    private boolean enabled;

    public Telemetry() {
        this(new CallAggregator(), new IdentityPropagator(), new Gson());
    }

    public Telemetry(CallAggregator aggregator, IdentityPropagator propagator) {
        this(aggregator, propagator, new Gson());
    }

    Telemetry(CallAggregator aggregator, IdentityPropagator propagator, Gson gson) {
        this.aggregator = aggregator;
        this.propagator = propagator;
        this.gson = gson;
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /** Starts tracing and takes the method that called this one as the tree's root. */
    public void enable() {
        enable(propagator.callerName(0));
    }

    /** Starts tracing under an explicitly named root. */
    public synchronized void enable(String rootName) {
        enabled = true;
        aggregator.setRoot(rootName);
    }

    /** Stops tracing and drops everything recorded so far. */
    public synchronized void disable() {
        enabled = false;
        aggregator.clear();
    }

    /** Drops everything recorded so far; tracing stays on or off as it was. */
    public void clear() {
        aggregator.clear();
    }

    public boolean isEnabled() {
        return enabled;
    }

    // -----------------------------------------------------------------------
    // Instrumentation
    // -----------------------------------------------------------------------

    /** Context for the first traced call of a run, rooted at the declared root. */
    public CallContext seed() {
        return CallContext.seed(aggregator.getRootName());
    }

    public CallContext derive(CallContext parent) {
        return propagator.derive(parent);
    }

    public CallContext derive(CallContext parent, String functionName) {
        return propagator.derive(parent, functionName);
    }

    /** Derives the calling method's context and starts measuring it. */
    public Span start(CallContext parent) {
        return begin(propagator.derive(parent));
    }

    public Span start(CallContext parent, String functionName) {
        return begin(propagator.derive(parent, functionName));
    }

    /** Starts measuring an already derived context. */
    public Span begin(CallContext context) {
        boolean recording = isEnabled();
        return new Span(this, context, recording ? aggregator.now() : 0L, recording);
    }

    /** Ticker reading to pass as {@code startNanos} when not using {@link Span}. */
    public long now() {
        return aggregator.now();
    }

    /** Records one completed call. Dropped when tracing is disabled. */
    public void observe(CallContext context, long startNanos) {
        if (!isEnabled()) return;
        aggregator.observe(context.getParentQualifiedName(), context.getQualifiedName(), startNanos);
    }

    // -----------------------------------------------------------------------
    // Export
    // -----------------------------------------------------------------------

    public String getRoot() {
        return aggregator.getRoot();
    }

    public SpanRecord snapshot() {
        return aggregator.snapshot();
    }

    public SpanRecord snapshot(String traceId) {
        return aggregator.snapshot(traceId);
    }

    /** Current tree as JSON; a fixed error object if serialization fails. */
    public String exportJson() {
        return toJson(aggregator.snapshot());
    }

    /** Tree of one trace as JSON; a fixed error object if serialization fails. */
    public String exportJson(String traceId) {
        return toJson(aggregator.snapshot(traceId));
    }

    private String toJson(SpanRecord tree) {
        try {
            return gson.toJson(tree);
        } catch (RuntimeException e) {
            System.err.println("[call-tracer] ERROR serializing call tree: " + e.getMessage());
            return EXPORT_ERROR_JSON;
        }
    }

    CallAggregator aggregator() {
        return aggregator;
    }
}
