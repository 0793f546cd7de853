package com.calltracer.fixture;

import com.calltracer.core.Tracing;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs {@link TaskChain} once under global tracing and prints the call tree to stdout.
 */
public class TaskChainMain {

    public static void main(String[] args) throws InterruptedException {
        Tracing.enable();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> pending = new TaskChain(Tracing.instance(), executor).run(Tracing.seed());
            pending.get();
        } catch (ExecutionException e) {
            System.err.println("[call-tracer] ERROR in task chain: " + e.getCause());
        } finally {
            executor.shutdown();
        }

        System.out.println(Tracing.getMetricsJson());
    }
}
