package com.demo.churn.service.monitoring;

/** Predicted vs actual churn counts over the labelled predictions of a window. */
public record ConfusionCounts(long truePositives, long falsePositives, long trueNegatives, long falseNegatives) {

    public static final ConfusionCounts EMPTY = new ConfusionCounts(0, 0, 0, 0);

    public ConfusionCounts plus(boolean predicted, boolean actual) {
        if (predicted && actual) return new ConfusionCounts(truePositives + 1, falsePositives, trueNegatives, falseNegatives);
        if (predicted) return new ConfusionCounts(truePositives, falsePositives + 1, trueNegatives, falseNegatives);
        if (actual) return new ConfusionCounts(truePositives, falsePositives, trueNegatives, falseNegatives + 1);
        return new ConfusionCounts(truePositives, falsePositives, trueNegatives + 1, falseNegatives);
    }

    public ConfusionCounts plus(ConfusionCounts o) {
        return new ConfusionCounts(truePositives + o.truePositives, falsePositives + o.falsePositives,
                trueNegatives + o.trueNegatives, falseNegatives + o.falseNegatives);
    }

    public long total() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }
}
