package com.demo.churn.service.explain;

import com.demo.churn.exception.ExplanationUnavailableException;
import com.demo.churn.service.model.ChurnClassifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shapley values estimated over a fixed set of feature permutations (each paired with its
 * reverse) and every background row.
 *
 * <p>For one permutation and one background row the marginal contributions telescope to
 * {@code f(x) - f(b)}, so the averaged contributions always add up to
 * {@code f(x) - mean f(b)} whatever the number of permutations. Permutations are drawn once
 * from a seeded generator, which keeps results reproducible.</p>
 */
public class PermutationShapAttributor implements FeatureAttributor {

    private final int[][] permutations;

    public PermutationShapAttributor(int featureCount, int pairs, long seed) {
        if (pairs < 1) throw new IllegalArgumentException("at least one permutation pair is required");
        Random rnd = new Random(seed);
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < featureCount; i++) order.add(i);
        this.permutations = new int[pairs * 2][featureCount];
        for (int p = 0; p < pairs; p++) {
            Collections.shuffle(order, rnd);
            for (int i = 0; i < featureCount; i++) {
                permutations[2 * p][i] = order.get(i);
                permutations[2 * p + 1][featureCount - 1 - i] = order.get(i);
            }
        }
    }

    @Override
    public String method() {
        return "permutation_shap";
    }

    @Override
    public boolean isExact() {
        return true;
    }

    @Override
    public Attribution attribute(AttributionContext ctx, double[] x) {
        if (!ctx.hasBackground()) {
            throw new ExplanationUnavailableException("No background sample for exact attribution", null);
        }
        ChurnClassifier model = ctx.model();
        double[][] background = ctx.background().rowsView();
        double[] bgPred = ctx.backgroundPredictions();
        int m = x.length;
        if (permutations[0].length != m) {
            throw new ExplanationUnavailableException("Permutations cover " + permutations[0].length + " features, input has " + m, null);
        }

        double[] phi = new double[m];
        double[] z = new double[m];
        try {
            for (int b = 0; b < background.length; b++) {
                for (int[] perm : permutations) {
                    System.arraycopy(background[b], 0, z, 0, m);
                    double prev = bgPred[b];
                    for (int j : perm) {
                        if (z[j] == x[j]) continue;
                        z[j] = x[j];
                        double cur = model.predictProba(z);
                        phi[j] += cur - prev;
                        prev = cur;
                    }
                }
            }
        } catch (RuntimeException e) {
            throw new ExplanationUnavailableException("Attribution failed: " + e.getMessage(), e);
        }

        double n = (double) background.length * permutations.length;
        for (int j = 0; j < m; j++) phi[j] /= n;
        return new Attribution(phi, ctx.baseline(), model.predictProba(x), method(), true);
    }
}
