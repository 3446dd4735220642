package com.demo.churn.service.model;

import java.util.List;

/**
 * Frozen binary classifier. Implementations are immutable after construction and
 * therefore safe to share between threads.
 */
public interface ChurnClassifier {

    String version();

    String type();

    /** Input columns in the order {@link #predictProba(double[])} expects them. */
    List<String> features();

    /** Probability of the churn class for one input row. */
    double predictProba(double[] x);

    /** Global importance per feature, non-negative and summing to 1. */
    double[] featureImportances();
}
