package com.calltracer.core;

import java.util.Objects;

/**
 * Identity of one traced call: its own name, its caller's name and the trace it belongs to.
 *
 * Immutable. Pass it down the call chain (and across threads) by value; every traced
 * call site derives a fresh one from its caller's through {@link IdentityPropagator}.
 */
public final class CallContext {

    private final String parentName;
    private final String functionName;
    private final String traceId;

    CallContext(String parentName, String functionName, String traceId) {
        this.parentName = parentName != null ? parentName : "";
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.traceId = traceId != null ? traceId : "";
    }

    /** Context handed to the first traced call of a run: no parent, no trace ID yet. */
    public static CallContext seed(String rootName) {
        return new CallContext("", rootName, "");
    }

    public String getParentName()   { return parentName; }
    public String getFunctionName() { return functionName; }
    public String getTraceId()      { return traceId; }

    /** Aggregator key of the caller. */
    public String getParentQualifiedName() {
        return QualifiedNames.qualify(parentName, traceId);
    }

    /** Aggregator key of this call. */
    public String getQualifiedName() {
        return QualifiedNames.qualify(functionName, traceId);
    }

    public boolean isSeed() {
        return traceId.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallContext other)) return false;
        return parentName.equals(other.parentName)
            && functionName.equals(other.functionName)
            && traceId.equals(other.traceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentName, functionName, traceId);
    }

    @Override
    public String toString() {
        return "CallContext{" + getParentQualifiedName() + " -> " + getQualifiedName() + "}";
    }
}
