package com.demo.churn.service.explain;

/**
 * Degraded attribution: the classifier's global importance profile, scaled so that it
 * spans {@code finalValue - baseline}. Every record gets the same ranking.
 */
public class GlobalImportanceAttributor implements FeatureAttributor {

    @Override
    public String method() {
        return "global_importance";
    }

    @Override
    public boolean isExact() {
        return false;
    }

    @Override
    public Attribution attribute(AttributionContext ctx, double[] x) {
        double[] importance = ctx.model().featureImportances();
        double fx = ctx.model().predictProba(x);
        double delta = fx - ctx.baseline();
        double[] contributions = new double[importance.length];
        for (int i = 0; i < importance.length; i++) {
            contributions[i] = importance[i] * delta;
        }
        return new Attribution(contributions, ctx.baseline(), fx, method(), false);
    }
}
