package com.demo.churn.service.dto;

import com.demo.churn.model.CustomerRecord;
import com.demo.churn.model.RiskLevel;
import com.demo.churn.service.features.FeatureVector;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/** Score of exactly one customer record. */
@Value
@Builder
public class PredictionResult {
    UUID predictionId;
    CustomerRecord record;
    FeatureVector features;
    /** Probability of churn, in [0, 1]. */
    double probability;
    /** True when the probability reaches the decision threshold. */
    boolean churn;
    RiskLevel riskLevel;
    /** Distance from the decision threshold, rescaled to [0, 1]. */
    double confidence;
    String modelVersion;
    Instant predictedAt;
}
