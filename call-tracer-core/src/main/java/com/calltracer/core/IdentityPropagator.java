package com.calltracer.core;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Derives the {@link CallContext} of a traced call from its caller's context.
 *
 * Function names default to {@code fully.qualified.Class.method()} of the calling method.
 * The trace ID is inherited from the incoming context; only a seed context (empty trace ID)
 * gets a new one, so every call descending from one root call, on whatever thread, shares it.
 *
 * Holds no mutable state: safe to share between any number of threads.
 */
public final class IdentityPropagator {

    static final String UNKNOWN_FUNCTION = "N/A";

    // Frames of the tracer's own entry points are skipped when looking for the caller.
    private static final Set<String> API_CLASSES = Set.of(
        IdentityPropagator.class.getName(),
        Telemetry.class.getName(),
        Tracing.class.getName()
    );

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final Supplier<String> traceIdSource;

    public IdentityPropagator() {
        this(IdentityPropagator::randomTraceId);
    }

    public IdentityPropagator(Supplier<String> traceIdSource) {
        this.traceIdSource = traceIdSource;
    }

    /** Derives the context of the method calling into the tracer. */
    public CallContext derive(CallContext parent) {
        return derive(parent, callerName(0));
    }

    /** Derives a context for an explicitly named function. */
    public CallContext derive(CallContext parent, String functionName) {
        String traceId = parent.getTraceId();
        if (traceId.isEmpty()) {
            traceId = newTraceId();
        }
        return new CallContext(parent.getFunctionName(), functionName, traceId);
    }

    /**
     * Name of the first method outside the tracer API on the current stack, after skipping
     * {@code extraFrames} further host frames. Returns {@code "N/A"} when the stack is too shallow.
     */
    public String callerName(int extraFrames) {
        Optional<String> name = WALKER.walk(frames -> frames
            .dropWhile(f -> API_CLASSES.contains(f.getClassName()))
            .skip(extraFrames)
            .findFirst()
            .map(f -> f.getClassName() + "." + f.getMethodName() + "()"));
        return name.orElse(UNKNOWN_FUNCTION);
    }

    String newTraceId() {
        String id = traceIdSource.get();
        if (id == null || id.isEmpty()) {
            id = randomTraceId();
        }
        return id.replace(QualifiedNames.SEPARATOR, '_');
    }

    static String randomTraceId() {
        return String.format("%016x", ThreadLocalRandom.current().nextLong());
    }
}
