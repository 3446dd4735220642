package com.demo.churn.service.explain;

import com.demo.churn.service.model.ChurnClassifier;

/**
 * Everything an attribution is computed against: one classifier, one background sample
 * and the baseline derived from both. Built once per loaded model and then only read.
 *
 * @param background            may be null when no background could be built
 * @param backgroundPredictions model output for each background row, aligned with it
 * @param baseline              mean model output over the background
 */
public record AttributionContext(ChurnClassifier model,
                                 BackgroundSample background,
                                 double[] backgroundPredictions,
                                 double baseline) {

    public static AttributionContext of(ChurnClassifier model, BackgroundSample background) {
        double[] preds = new double[background.size()];
        double sum = 0;
        for (int i = 0; i < preds.length; i++) {
            preds[i] = model.predictProba(background.rowsView()[i]);
            sum += preds[i];
        }
        return new AttributionContext(model, background, preds, sum / preds.length);
    }

    /** Context without a background; the baseline falls back to the given value. */
    public static AttributionContext withoutBackground(ChurnClassifier model, double baseline) {
        return new AttributionContext(model, null, new double[0], baseline);
    }

    public boolean hasBackground() {
        return background != null;
    }
}
