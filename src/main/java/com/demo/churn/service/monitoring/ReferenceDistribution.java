package com.demo.churn.service.monitoring;

import com.demo.churn.service.monitoring.DriftCalculator.Binning;

import java.util.ArrayList;
import java.util.List;

/** Binned reference of every feature column and of the model output, built once per model. */
public final class ReferenceDistribution {

    private final List<String> features;
    private final List<Binning> featureBins;
    private final Binning probabilityBins;
    private final int size;

    private ReferenceDistribution(List<String> features, List<Binning> featureBins,
                                  Binning probabilityBins, int size) {
        this.features = features;
        this.featureBins = featureBins;
        this.probabilityBins = probabilityBins;
        this.size = size;
    }

    /**
     * @param rows          encoded reference rows, in {@code features} order
     * @param probabilities model output for each row
     */
    public static ReferenceDistribution of(List<String> features, double[][] rows,
                                           double[] probabilities, int bins) {
        if (rows.length != probabilities.length) {
            throw new IllegalArgumentException(rows.length + " rows but " + probabilities.length + " probabilities");
        }
        List<Binning> featureBins = new ArrayList<>(features.size());
        for (int j = 0; j < features.size(); j++) {
            double[] column = new double[rows.length];
            for (int i = 0; i < rows.length; i++) column[i] = rows[i][j];
            featureBins.add(DriftCalculator.binning(column, bins));
        }
        return new ReferenceDistribution(List.copyOf(features), List.copyOf(featureBins),
                DriftCalculator.binning(probabilities, bins), rows.length);
    }

    public List<String> features() {
        return features;
    }

    public Binning featureBins(int j) {
        return featureBins.get(j);
    }

    public Binning probabilityBins() {
        return probabilityBins;
    }

    public int size() {
        return size;
    }
}
