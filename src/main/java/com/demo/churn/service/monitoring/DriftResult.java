package com.demo.churn.service.monitoring;

import java.util.Map;

/**
 * @param score        overall drift (maximum per-feature PSI), null when it could not be computed
 * @param featureScores PSI per feature; empty when the probability fallback was used
 * @param basis        {@code features}, {@code probability} or {@code none}
 */
public record DriftResult(Double score, Map<String, Double> featureScores, String basis) {

    public static final DriftResult NONE = new DriftResult(null, Map.of(), "none");
}
