package com.calltracer.core;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * Timing statistics of one traced call (or of a container node), plus its children.
 *
 * Serialized as one node of the exported snapshot tree.
 */
public class SpanRecord {

    /** Lower ceiling of a record that has not folded in any duration yet. */
    public static final long UNSET_LOWER_CEILING = Integer.MAX_VALUE;

    @SerializedName("Parent")        public String parent;
    @SerializedName("Function")      public String function;
    @SerializedName("Calls")         public int calls;
    @SerializedName("TotalTimeMs")   public long totalTimeMs;
    @SerializedName("AverageTimeMs") public double averageTimeMs;
    @SerializedName("LowerCeiling")  public long lowerCeiling = UNSET_LOWER_CEILING;
    @SerializedName("HigherCeiling") public long higherCeiling;
    @SerializedName("Children")      public List<SpanRecord> children = new ArrayList<>();

    public SpanRecord() {}

    /** Zeroed record. */
    public SpanRecord(String parent, String function) {
        this.parent = parent;
        this.function = function;
    }

    /** Record of a single completed call. */
    public static SpanRecord ofCall(String parent, String function, long elapsedMs) {
        SpanRecord record = new SpanRecord(parent, function);
        record.fold(elapsedMs);
        return record;
    }

    /** Folds one more duration into the counters. */
    public void fold(long elapsedMs) {
        calls++;
        totalTimeMs += elapsedMs;
        if (elapsedMs < lowerCeiling) lowerCeiling = elapsedMs;
        if (elapsedMs > higherCeiling) higherCeiling = elapsedMs;
    }

    /** Recomputes {@link #averageTimeMs}; 0 when no call has been folded in. */
    public double computeAverage() {
        averageTimeMs = calls <= 0 ? 0.0 : (double) totalTimeMs / calls;
        return averageTimeMs;
    }

    /** Copies the counters but not the children. */
    SpanRecord copyWithoutChildren() {
        SpanRecord copy = new SpanRecord(parent, function);
        copy.calls = calls;
        copy.totalTimeMs = totalTimeMs;
        copy.averageTimeMs = averageTimeMs;
        copy.lowerCeiling = lowerCeiling;
        copy.higherCeiling = higherCeiling;
        return copy;
    }

    @Override
    public String toString() {
        return "SpanRecord{" + function + ", calls=" + calls + ", totalTimeMs=" + totalTimeMs
            + ", children=" + children.size() + "}";
    }
}
