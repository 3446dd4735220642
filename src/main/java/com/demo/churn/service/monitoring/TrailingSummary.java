package com.demo.churn.service.monitoring;

import java.time.Instant;

/** Totals over the retained snapshot history. */
public record TrailingSummary(Instant from,
                              Instant to,
                              int snapshots,
                              long volume,
                              long churnCount,
                              Double churnRate,
                              long highRiskCount,
                              ConfusionCounts confusion,
                              PerformanceMetrics performance,
                              Double maxDriftScore) {
}
