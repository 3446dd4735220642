package com.demo.churn.service.monitoring;

import com.demo.churn.model.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Closed monitoring window. */
@Value
@Builder
public class MonitoringSnapshot {
    Instant windowStart;
    Instant windowEnd;
    long volume;
    long churnCount;
    /** Share of predicted churners, null for an empty window. */
    Double churnRate;
    Double meanProbability;
    long highRiskCount;
    Map<RiskLevel, Long> riskDistribution;
    ConfusionCounts confusion;
    PerformanceMetrics performance;
    /** Null when the window was empty or no reference was available. */
    Double driftScore;
    Map<String, Double> featureDrift;
    String driftBasis;
    String modelVersion;
}
