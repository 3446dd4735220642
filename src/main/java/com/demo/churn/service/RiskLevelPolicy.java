package com.demo.churn.service;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.model.RiskLevel;

/**
 * LOW below {@code lowUpper}, HIGH above {@code highLower}, MEDIUM in between with both
 * boundaries inclusive.
 */
public record RiskLevelPolicy(double lowUpper, double highLower) {

    public RiskLevelPolicy {
        if (!(0 <= lowUpper && lowUpper <= highLower && highLower <= 1)) {
            throw new IllegalArgumentException("risk cutoffs must satisfy 0 <= low <= high <= 1, got " + lowUpper + ", " + highLower);
        }
    }

    public static RiskLevelPolicy from(ChurnProperties.Risk risk) {
        return new RiskLevelPolicy(risk.getLowUpper(), risk.getHighLower());
    }

    public RiskLevel classify(double probability) {
        if (probability < lowUpper) return RiskLevel.LOW;
        if (probability > highLower) return RiskLevel.HIGH;
        return RiskLevel.MEDIUM;
    }
}
