package com.demo.churn.service.model;

final class Importances {

    private Importances() {}

    /** Scales to a unit sum; an all-zero vector becomes uniform. */
    static double[] normalize(double[] raw) {
        double sum = 0;
        for (double v : raw) {
            if (v < 0 || !Double.isFinite(v)) throw new IllegalArgumentException("importances must be finite and >= 0");
            sum += v;
        }
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = sum == 0 ? 1.0 / raw.length : raw[i] / sum;
        }
        return out;
    }
}
