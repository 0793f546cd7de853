package com.calltracer.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped measurement of one traced call. Open it with {@link Telemetry#start} in a
 * try-with-resources block; {@link #close()} records the call exactly once, whichever way
 * the block is left.
 * <pre>
 * try (Span span = telemetry.start(context)) {
 *     taskB(span.context());
 * }
 * </pre>
 */
public final class Span implements AutoCloseable {

    private final Telemetry telemetry;
    private final CallContext context;
    private final long startNanos;
    private final boolean recording;
    private final AtomicBoolean closed = new AtomicBoolean();

    Span(Telemetry telemetry, CallContext context, long startNanos, boolean recording) {
        this.telemetry = telemetry;
        this.context = context;
        this.startNanos = startNanos;
        this.recording = recording;
    }

    /** Context of this call; pass it to the calls made from inside the span. */
    public CallContext context() {
        return context;
    }

    /** False when tracing was disabled at entry; closing such a span records nothing. */
    public boolean isRecording() {
        return recording;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (recording) {
            telemetry.observe(context, startNanos);
        }
    }
}
