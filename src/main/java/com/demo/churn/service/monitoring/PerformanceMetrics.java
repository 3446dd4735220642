package com.demo.churn.service.monitoring;

import com.demo.churn.config.ChurnProperties;

/**
 * Classification metrics over labelled predictions. A metric is null when it is undefined
 * (no labels at all, no predicted positives for precision, no actual positives for recall),
 * never a default value.
 */
public record PerformanceMetrics(boolean available,
                                 long labelled,
                                 Double accuracy,
                                 Double precision,
                                 Double recall,
                                 Double f1) {

    public static final PerformanceMetrics UNAVAILABLE = new PerformanceMetrics(false, 0, null, null, null, null);

    public static PerformanceMetrics from(ConfusionCounts c) {
        long n = c.total();
        if (n == 0) return UNAVAILABLE;
        double accuracy = (double) (c.truePositives() + c.trueNegatives()) / n;
        Double precision = ratio(c.truePositives(), c.truePositives() + c.falsePositives());
        Double recall = ratio(c.truePositives(), c.truePositives() + c.falseNegatives());
        Double f1 = null;
        if (precision != null && recall != null) {
            f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        }
        return new PerformanceMetrics(true, n, accuracy, precision, recall, f1);
    }

    /** Value of the metric used for alerting, or null when it is not available. */
    public Double value(ChurnProperties.Alerts.Metric metric) {
        switch (metric) {
            case PRECISION:
                return precision;
            case RECALL:
                return recall;
            case F1:
                return f1;
            default:
                return accuracy;
        }
    }

    private static Double ratio(long num, long den) {
        return den == 0 ? null : (double) num / den;
    }
}
