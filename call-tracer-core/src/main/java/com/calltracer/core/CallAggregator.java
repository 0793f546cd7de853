package com.calltracer.core;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Thread-safe in-memory aggregator of completed traced calls.
 *
 * Table layout: one entry per parent key, each holding the records of the calls that
 * completed under it, in completion order.
 * <pre>
 * main()@t1
 *    +-- taskA()@t1  calls=1 total=10
 * taskA()@t1
 *    +-- taskB()@t1  calls=1 total=5
 *    +-- taskB()@t1  calls=1 total=15
 * </pre>
 * Every completed call appends its own record; calls are never folded into one counter per
 * function, so the exported tree reads as an invocation timeline.
 *
 * One lock guards the table and the root; each public method is a single critical section.
 */
public final class CallAggregator {

    static final String DEFAULT_ROOT = "main()";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SpanRecord> table = new HashMap<>();
    private final LongSupplier ticker;

    // Root as declared, and root anchored to the first trace that touched an empty table.
    private String rootName = DEFAULT_ROOT;
    private String root = DEFAULT_ROOT;

    public CallAggregator() {
        this(System::nanoTime);
    }

    /** @param ticker monotonic time source in nanoseconds, the same one start times are read from */
    public CallAggregator(LongSupplier ticker) {
        this.ticker = ticker;
    }

    /** Current reading of the ticker; the start time to hand back to {@link #observe}. */
    public long now() {
        return ticker.getAsLong();
    }

    // -----------------------------------------------------------------------
    // Recording
    // -----------------------------------------------------------------------

    /**
     * Records one completed call of {@code ownKey} under {@code parentKey}.
     *
     * @param startNanos ticker reading taken when the call was entered
     */
    public void observe(String parentKey, String ownKey, long startNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(ticker.getAsLong() - startNanos);
        lock.lock();
        try {
            if (table.isEmpty()) {
                root = QualifiedNames.qualify(rootName, QualifiedNames.traceIdOf(parentKey));
            }
            SpanRecord parent = table.computeIfAbsent(parentKey, k -> new SpanRecord(k, k));
            parent.children.add(SpanRecord.ofCall(parentKey, ownKey, Math.max(0L, elapsedMs)));
        } finally {
            lock.unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Root
    // -----------------------------------------------------------------------

    public void setRoot(String name) {
        lock.lock();
        try {
            rootName = name;
            root = name;
        } finally {
            lock.unlock();
        }
    }

    /** Root key of the current run: the declared root suffixed with the first trace's ID. */
    public String getRoot() {
        lock.lock();
        try {
            return root;
        } finally {
            lock.unlock();
        }
    }

    /** Root as declared, without any trace ID. */
    public String getRootName() {
        lock.lock();
        try {
            return rootName;
        } finally {
            lock.unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Snapshots
    // -----------------------------------------------------------------------

    /** Point-in-time tree anchored at the current root. */
    public SpanRecord snapshot() {
        lock.lock();
        try {
            return new CallTreeBuilder(table, root).build();
        } finally {
            lock.unlock();
        }
    }

    /** Point-in-time tree of the given trace, anchored at the declared root. */
    public SpanRecord snapshot(String traceId) {
        lock.lock();
        try {
            return new CallTreeBuilder(table, QualifiedNames.qualify(rootName, traceId)).build();
        } finally {
            lock.unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Reset
    // -----------------------------------------------------------------------

    /** Removes every entry. The root is kept. */
    public void clear() {
        lock.lock();
        try {
            table.clear();
        } finally {
            lock.unlock();
        }
    }

    /** Number of parent entries in the table. */
    public int size() {
        lock.lock();
        try {
            return table.size();
        } finally {
            lock.unlock();
        }
    }
}
