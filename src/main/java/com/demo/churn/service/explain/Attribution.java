package com.demo.churn.service.explain;

/**
 * Additive decomposition of one model output: {@code finalValue = baseline + sum(contributions)}.
 */
public record Attribution(double[] contributions, double baseline, double finalValue, String method, boolean exact) {
}
