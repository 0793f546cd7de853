package com.calltracer.fixture;

import com.calltracer.core.CallContext;
import com.calltracer.core.Span;
import com.calltracer.core.Telemetry;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sample workload: taskA calls taskB, taskB hands taskC to the executor, taskC calls taskD.
 * Each task sleeps a random 0-99 ms. The calling context is passed explicitly, so the
 * asynchronous branch stays in the trace of the call that started it.
 */
public class TaskChain {

    private final Telemetry telemetry;
    private final ExecutorService executor;

    public TaskChain(Telemetry telemetry, ExecutorService executor) {
        this.telemetry = telemetry;
        this.executor = executor;
    }

    /** Runs the chain below {@code parent}; the returned future completes with the async branch. */
    public Future<?> run(CallContext parent) {
        return taskA(parent);
    }

    Future<?> taskA(CallContext parent) {
        try (Span span = telemetry.start(parent)) {
            pause();
            return taskB(span.context());
        }
    }

    Future<?> taskB(CallContext parent) {
        try (Span span = telemetry.start(parent)) {
            pause();
            CallContext context = span.context();
            return executor.submit(() -> taskC(context));
        }
    }

    void taskC(CallContext parent) {
        try (Span span = telemetry.start(parent)) {
            pause();
            taskD(span.context());
        }
    }

    void taskD(CallContext parent) {
        try (Span span = telemetry.start(parent)) {
            pause();
        }
    }

    private static void pause() {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextInt(100));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
