package com.demo.churn.service.model;

import java.util.Arrays;
import java.util.List;

/** Standardized logistic regression: p = sigmoid(b + sum(w_i * (x_i - mu_i) / s_i)). */
public final class LogisticChurnClassifier implements ChurnClassifier {

    private final String version;
    private final List<String> features;
    private final double intercept;
    private final double[] coefficients;
    private final double[] means;
    private final double[] scales;
    private final double[] importances;

    public LogisticChurnClassifier(String version, List<String> features, double intercept,
                                   double[] coefficients, double[] means, double[] scales,
                                   double[] importances) {
        int n = features.size();
        if (coefficients.length != n) {
            throw new IllegalArgumentException("expected " + n + " coefficients, got " + coefficients.length);
        }
        this.version = version;
        this.features = List.copyOf(features);
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
        this.means = means == null ? new double[n] : checkLength(means.clone(), n, "means");
        this.scales = scales == null ? ones(n) : checkLength(scales.clone(), n, "scales");
        for (int i = 0; i < n; i++) {
            if (this.scales[i] == 0.0) this.scales[i] = 1.0;
        }
        this.importances = importances != null
                ? Importances.normalize(checkLength(importances.clone(), n, "feature_importances"))
                : Importances.normalize(absolute(this.coefficients));
    }

    @Override public String version() { return version; }

    @Override public String type() { return "logistic"; }

    @Override public List<String> features() { return features; }

    @Override
    public double predictProba(double[] x) {
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * (x[i] - means[i]) / scales[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public double[] featureImportances() {
        return importances.clone();
    }

    private static double[] ones(int n) {
        double[] d = new double[n];
        Arrays.fill(d, 1.0);
        return d;
    }

    private static double[] absolute(double[] w) {
        double[] a = new double[w.length];
        for (int i = 0; i < w.length; i++) a[i] = Math.abs(w[i]);
        return a;
    }

    private static double[] checkLength(double[] d, int n, String what) {
        if (d.length != n) throw new IllegalArgumentException("expected " + n + " " + what + ", got " + d.length);
        return d;
    }
}
