package com.calltracer.core;

/**
 * Helpers for the {@code <name>@<traceId>} keys used by the aggregator.
 *
 * Trace IDs never contain the separator, so the trace ID is always the text after
 * the last {@code @}; names are free to contain it.
 */
public final class QualifiedNames {

    public static final char SEPARATOR = '@';

    private QualifiedNames() {}

    /** Appends {@code traceId} to {@code name}. An empty trace ID leaves the name bare. */
    public static String qualify(String name, String traceId) {
        if (traceId == null || traceId.isEmpty()) return name;
        return name + SEPARATOR + traceId;
    }

    /** Returns the trace ID suffix of a qualified name, or "" when there is none. */
    public static String traceIdOf(String qualifiedName) {
        if (qualifiedName == null) return "";
        int idx = qualifiedName.lastIndexOf(SEPARATOR);
        return idx < 0 ? "" : qualifiedName.substring(idx + 1);
    }

    /** Returns the bare function name of a qualified name. */
    public static String nameOf(String qualifiedName) {
        if (qualifiedName == null) return "";
        int idx = qualifiedName.lastIndexOf(SEPARATOR);
        return idx < 0 ? qualifiedName : qualifiedName.substring(0, idx);
    }
}
