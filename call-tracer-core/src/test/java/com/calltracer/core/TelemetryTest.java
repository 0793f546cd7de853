package com.calltracer.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryTest {

    private final AtomicLong clock = new AtomicLong();
    private final AtomicInteger ids = new AtomicInteger();
    private CallAggregator aggregator;
    private Telemetry telemetry;

    @BeforeEach
    void setUp() {
        aggregator = new CallAggregator(clock::get);
        telemetry = new Telemetry(aggregator, new IdentityPropagator(() -> "t" + ids.incrementAndGet()));
    }

    private void advance(long ms) {
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(ms));
    }

    private long msAgo(long ms) {
        return clock.get() - TimeUnit.MILLISECONDS.toNanos(ms);
    }

    // --- Lifecycle ---

    @Test
    void disabledByDefault() {
        assertFalse(telemetry.isEnabled());
    }

    @Test
    void enableCapturesCallingMethodAsRoot() {
        telemetry.enable();
        assertTrue(telemetry.isEnabled());
        String expected = TelemetryTest.class.getName() + ".enableCapturesCallingMethodAsRoot()";
        assertEquals(expected, telemetry.getRoot());
        assertEquals(expected, telemetry.seed().getFunctionName());
        assertTrue(telemetry.seed().isSeed());
    }

    @Test
    void disableWipesRecordedCalls() {
        telemetry.enable("main()");
        telemetry.observe(telemetry.derive(telemetry.seed(), "taskA()"), msAgo(1));
        assertEquals(1, aggregator.size());

        telemetry.disable();
        assertFalse(telemetry.isEnabled());
        assertEquals(0, aggregator.size());
    }

    @Test
    void clearKeepsTracingEnabled() {
        telemetry.enable("main()");
        telemetry.observe(telemetry.derive(telemetry.seed(), "taskA()"), msAgo(1));
        telemetry.clear();

        assertTrue(telemetry.isEnabled());
        assertTrue(telemetry.snapshot().children.isEmpty());
    }

    @Test
    void observationsWhileDisabledAreDropped() {
        telemetry.observe(telemetry.derive(CallContext.seed("main()"), "taskA()"), msAgo(1));
        assertEquals(0, aggregator.size());
    }

    // --- Spans ---

    @Test
    void spanRecordsExactlyOnce() {
        telemetry.enable("main()");
        Span span = telemetry.start(telemetry.seed(), "taskA()");
        advance(3);
        span.close();
        span.close();

        List<SpanRecord> children = telemetry.snapshot().children;
        assertEquals(1, children.size());
        assertEquals(3, children.get(0).totalTimeMs);
    }

    @Test
    void spanRecordsWhenCallThrows() {
        telemetry.enable("main()");
        assertThrows(IllegalStateException.class, () -> {
            try (Span ignored = telemetry.start(telemetry.seed(), "failing()")) {
                advance(2);
                throw new IllegalStateException("boom");
            }
        });
        SpanRecord failing = telemetry.snapshot().children.get(0);
        assertEquals("failing()@t1", failing.function);
        assertEquals(2, failing.totalTimeMs);
    }

    @Test
    void spanRecordsOnEarlyReturn() {
        telemetry.enable("main()");
        assertEquals(-1, lookup(telemetry.seed(), true));
        assertEquals(1, telemetry.snapshot().children.size());
    }

    private int lookup(CallContext parent, boolean bail) {
        try (Span ignored = telemetry.start(parent, "lookup()")) {
            if (bail) {
                return -1;
            }
            advance(1);
            return 1;
        }
    }

    @Test
    void spanStartedWhileDisabledCarriesContextButRecordsNothing() {
        try (Span span = telemetry.start(CallContext.seed("main()"), "taskA()")) {
            assertFalse(span.isRecording());
            assertEquals("taskA()@t1", span.context().getQualifiedName());
        }
        assertEquals(0, aggregator.size());
    }

    @Test
    void startIntrospectsCallingMethod() {
        telemetry.enable("main()");
        try (Span span = telemetry.start(telemetry.seed())) {
            assertEquals(TelemetryTest.class.getName() + ".startIntrospectsCallingMethod()",
                span.context().getFunctionName());
        }
    }

    @Test
    void nestedSpansBuildTree() {
        telemetry.enable("main()");
        try (Span a = telemetry.start(telemetry.seed(), "taskA()")) {
            try (Span b = telemetry.start(a.context(), "taskB()")) {
                advance(5);
                try (Span ignored = telemetry.start(b.context(), "taskC()")) {
                    advance(1);
                }
            }
            advance(4);
        }

        SpanRecord root = telemetry.snapshot();
        assertEquals("main()@t1", root.function);
        SpanRecord a = root.children.get(0);
        assertEquals(10, a.totalTimeMs);
        SpanRecord b = a.children.get(0);
        assertEquals("taskB()@t1", b.function);
        assertEquals(6, b.totalTimeMs);
        assertEquals("taskC()@t1", b.children.get(0).function);
    }

    // --- End to end ---

    @Test
    void endToEndTimeline() {
        telemetry.enable("main()");
        CallContext a = telemetry.derive(telemetry.seed(), "taskA()");
        CallContext b = telemetry.derive(a, "taskB()");

        telemetry.observe(b, msAgo(5));
        telemetry.observe(b, msAgo(15));
        telemetry.observe(a, msAgo(10));

        SpanRecord root = telemetry.snapshot();
        assertEquals(1, root.children.size());
        SpanRecord taskA = root.children.get(0);
        assertEquals("taskA()@t1", taskA.function);
        assertEquals(1, taskA.calls);
        assertEquals(10, taskA.totalTimeMs);
        assertEquals(10, taskA.lowerCeiling);
        assertEquals(10, taskA.higherCeiling);

        assertEquals(2, taskA.children.size());
        assertEquals(20, taskA.children.stream().mapToLong(r -> r.totalTimeMs).sum());
        assertEquals(5, taskA.children.stream().mapToLong(r -> r.lowerCeiling).min().orElseThrow());
        assertEquals(15, taskA.children.stream().mapToLong(r -> r.higherCeiling).max().orElseThrow());
        taskA.children.forEach(r -> assertEquals(1, r.calls));
    }

    @Test
    void concurrentBranchesLoseNoCalls() throws Exception {
        int branches = 8;
        int callsPerBranch = 250;
        telemetry.enable("main()");
        ExecutorService pool = Executors.newFixedThreadPool(branches);
        try (Span a = telemetry.start(telemetry.seed(), "taskA()")) {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < branches; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < callsPerBranch; j++) {
                        try (Span ignored = telemetry.start(a.context(), "worker()")) {
                            Thread.onSpinWait();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdown();
        }

        SpanRecord taskA = telemetry.snapshot().children.get(0);
        assertEquals(branches * callsPerBranch, taskA.children.stream().mapToInt(r -> r.calls).sum());
        taskA.children.forEach(r -> assertEquals("worker()@t1", r.function));
    }

    // --- Export ---

    @Test
    void exportUsesSnapshotFieldNames() {
        telemetry.enable("main()");
        telemetry.observe(telemetry.derive(telemetry.seed(), "taskA()"), msAgo(8));

        JsonObject root = JsonParser.parseString(telemetry.exportJson()).getAsJsonObject();
        for (String key : List.of("Parent", "Function", "Calls", "TotalTimeMs", "AverageTimeMs",
                                  "LowerCeiling", "HigherCeiling", "Children")) {
            assertTrue(root.has(key), "missing " + key);
        }
        JsonObject a = root.getAsJsonArray("Children").get(0).getAsJsonObject();
        assertEquals("taskA()@t1", a.get("Function").getAsString());
        assertEquals("main()@t1", a.get("Parent").getAsString());
        assertEquals(8, a.get("TotalTimeMs").getAsInt());
        assertEquals(8.0, a.get("AverageTimeMs").getAsDouble());
        assertEquals(0, a.getAsJsonArray("Children").size());
    }

    @Test
    void exportParsesBackIntoTree() {
        telemetry.enable("main()");
        CallContext a = telemetry.derive(telemetry.seed(), "taskA()");
        telemetry.observe(telemetry.derive(a, "taskB()"), msAgo(2));
        telemetry.observe(a, msAgo(3));

        SpanRecord parsed = new Gson().fromJson(telemetry.exportJson(), SpanRecord.class);
        assertEquals("main()@t1", parsed.function);
        assertEquals("taskB()@t1", parsed.children.get(0).children.get(0).function);
    }

    @Test
    void exportOfAnotherTrace() {
        telemetry.enable("main()");
        telemetry.observe(telemetry.derive(telemetry.seed(), "first()"), msAgo(1));
        telemetry.observe(telemetry.derive(telemetry.seed(), "second()"), msAgo(1));

        SpanRecord second = new Gson().fromJson(telemetry.exportJson("t2"), SpanRecord.class);
        assertEquals("main()@t2", second.function);
        assertEquals("second()@t2", second.children.get(0).function);
        assertEquals(1, telemetry.snapshot().children.size());
    }

    @Test
    void serializationFailureYieldsErrorPayload() {
        Gson broken = new GsonBuilder()
            .registerTypeAdapter(SpanRecord.class, new TypeAdapter<SpanRecord>() {
                @Override
                public void write(JsonWriter out, SpanRecord value) {
                    throw new IllegalStateException("cannot write");
                }

                @Override
                public SpanRecord read(JsonReader in) {
                    throw new UnsupportedOperationException();
                }
            })
            .create();
        Telemetry failing = new Telemetry(aggregator, new IdentityPropagator(), broken);

        assertEquals("{\"error\": \"Could not marshal the telemetry metrics\"}", failing.exportJson());
    }
}
