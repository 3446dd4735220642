package com.demo.churn.service.batch;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-segment totals. {@link #combine} is commutative and associative, so workers can merge in any order. */
public record SegmentStats(long count, double probabilitySum, long churnCount) {

    public static SegmentStats of(double probability, boolean churn) {
        return new SegmentStats(1, probability, churn ? 1 : 0);
    }

    public SegmentStats combine(SegmentStats o) {
        return new SegmentStats(count + o.count, probabilitySum + o.probabilitySum, churnCount + o.churnCount);
    }

    @JsonProperty
    public double meanProbability() {
        return count == 0 ? 0 : probabilitySum / count;
    }

    @JsonProperty
    public double churnRate() {
        return count == 0 ? 0 : (double) churnCount / count;
    }
}
