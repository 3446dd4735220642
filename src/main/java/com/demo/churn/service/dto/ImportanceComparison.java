package com.demo.churn.service.dto;

import java.util.Map;

/**
 * Importance the classifier reports for itself next to the importance observed through
 * attribution. {@code meanAbsContribution} is null when only approximate attribution runs.
 */
public record ImportanceComparison(String modelVersion,
                                   Map<String, Double> modelImportance,
                                   Map<String, Double> meanAbsContribution) {
}
