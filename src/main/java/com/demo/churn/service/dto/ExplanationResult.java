package com.demo.churn.service.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Per-feature explanation of one prediction. Contributions add up to
 * {@code finalValue - baselineValue}.
 */
@Value
@Builder
public class ExplanationResult {
    UUID predictionId;
    String customerId;
    /** {@code permutation_shap} or {@code global_importance}. */
    String method;
    /** True when contributions come from the degraded global importance method. */
    boolean approximate;
    double baselineValue;
    double finalValue;
    /** Every feature, ranked by absolute contribution, largest first. */
    List<FeatureContribution> contributions;
    /** Head of {@link #contributions} with titles and texts. */
    List<FeatureContribution> topFactors;
    String summary;
    List<String> recommendedActions;
    String locale;
    String modelVersion;

    public double contributionSum() {
        return contributions.stream().mapToDouble(FeatureContribution::getContribution).sum();
    }
}
