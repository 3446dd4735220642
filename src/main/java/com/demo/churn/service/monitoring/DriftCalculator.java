package com.demo.churn.service.monitoring;

import java.util.Arrays;

/**
 * Population Stability Index over quantile bins of a reference column.
 *
 * <p>{@code PSI = sum((a - e) * ln(a / e))} over bins, with expected proportions {@code e}
 * from the reference and actual proportions {@code a} from the window, each floored at
 * {@link #EPSILON}. Identical distributions give 0.</p>
 */
public final class DriftCalculator {

    public static final double EPSILON = 1e-4;

    private DriftCalculator() {}

    /** Reference binning: the cut points and the share of reference values in each bin. */
    public record Binning(double[] edges, double[] expected) {

        public int bins() {
            return expected.length;
        }
    }

    public static Binning binning(double[] reference, int bins) {
        if (reference.length == 0) throw new IllegalArgumentException("reference column is empty");
        if (bins < 2) throw new IllegalArgumentException("at least two bins are required");
        double[] sorted = reference.clone();
        Arrays.sort(sorted);
        // distinct quantile cut points; ties collapse bins
        double[] cuts = new double[bins - 1];
        int n = 0;
        for (int i = 1; i < bins; i++) {
            double q = quantile(sorted, (double) i / bins);
            if (n == 0 || q > cuts[n - 1]) cuts[n++] = q;
        }
        double[] edges = Arrays.copyOf(cuts, n);
        return new Binning(edges, proportions(edges, reference));
    }

    public static double psi(Binning reference, double[] actual) {
        if (actual.length == 0) throw new IllegalArgumentException("window is empty");
        double[] a = proportions(reference.edges(), actual);
        double[] e = reference.expected();
        double psi = 0;
        for (int i = 0; i < e.length; i++) {
            psi += (a[i] - e[i]) * Math.log(a[i] / e[i]);
        }
        return psi;
    }

    static int bin(double[] edges, double v) {
        int i = Arrays.binarySearch(edges, v);
        // v <= edge[i] goes to bin i
        return i >= 0 ? i : -i - 1;
    }

    private static double[] proportions(double[] edges, double[] values) {
        double[] p = new double[edges.length + 1];
        for (double v : values) p[bin(edges, v)]++;
        for (int i = 0; i < p.length; i++) p[i] = Math.max(p[i] / values.length, EPSILON);
        return p;
    }

    private static double quantile(double[] sorted, double q) {
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }
}
