package com.calltracer.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the nested call tree from the aggregator's flat table.
 *
 * The table is read only; every returned node is a copy, so a snapshot never changes
 * after it has been handed out and never aliases the live table. Callers must hold the
 * aggregator's lock for the duration of {@link #build}.
 */
final class CallTreeBuilder {

    private final Map<String, SpanRecord> table;
    private final String rootKey;
    // Keys being expanded on the current path; a recursive function would otherwise loop.
    private final Set<String> expanding = new HashSet<>();

    CallTreeBuilder(Map<String, SpanRecord> table, String rootKey) {
        this.table = table;
        this.rootKey = rootKey;
    }

    /** Synthetic root named after the anchor key, with the reconstructed children below it. */
    SpanRecord build() {
        SpanRecord root = new SpanRecord(rootKey, rootKey);
        root.computeAverage();
        root.children = buildChildren(rootKey, rootKey);
        return root;
    }

    /**
     * Children recorded under {@code nodeKey} that belong to the branch of {@code branchKey}.
     * Everything below the anchor belongs; deeper down a child must carry the branch's trace ID.
     */
    List<SpanRecord> buildChildren(String nodeKey, String branchKey) {
        List<SpanRecord> result = new ArrayList<>();
        SpanRecord node = table.get(nodeKey);
        if (node == null || !expanding.add(nodeKey)) {
            return result;
        }
        String branchTraceId = QualifiedNames.traceIdOf(branchKey);
        boolean fromAnchor = rootKey.equals(branchKey);

        for (SpanRecord child : node.children) {
            if (!fromAnchor && !QualifiedNames.traceIdOf(child.function).equals(branchTraceId)) {
                continue;
            }
            SpanRecord copy = child.copyWithoutChildren();
            copy.computeAverage();
            String childKey = QualifiedNames.qualify(
                QualifiedNames.nameOf(child.function), QualifiedNames.traceIdOf(child.parent));
            copy.children = buildChildren(childKey, child.function);
            result.add(copy);
        }
        expanding.remove(nodeKey);
        return result;
    }
}
