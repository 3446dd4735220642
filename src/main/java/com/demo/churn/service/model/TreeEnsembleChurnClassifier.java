package com.demo.churn.service.model;

import java.util.List;

/**
 * Bagged decision trees (random-forest style). Each tree routes left when
 * {@code x[feature] <= threshold}; the ensemble output is the mean leaf probability.
 */
public final class TreeEnsembleChurnClassifier implements ChurnClassifier {

    private final String version;
    private final List<String> features;
    private final List<FlatTree> trees;
    private final double[] importances;

    public TreeEnsembleChurnClassifier(String version, List<String> features, List<ModelArtifact.Tree> trees,
                                       double[] importances) {
        if (trees == null || trees.isEmpty()) throw new IllegalArgumentException("tree ensemble has no trees");
        this.version = version;
        this.features = List.copyOf(features);
        this.trees = trees.stream().map(t -> FlatTree.of(t, features.size())).toList();
        if (importances != null) {
            if (importances.length != features.size()) {
                throw new IllegalArgumentException("expected " + features.size() + " feature_importances, got " + importances.length);
            }
            this.importances = Importances.normalize(importances.clone());
        } else {
            double[] splits = new double[features.size()];
            for (FlatTree t : this.trees) t.countSplits(splits);
            this.importances = Importances.normalize(splits);
        }
    }

    @Override public String version() { return version; }

    @Override public String type() { return "tree_ensemble"; }

    @Override public List<String> features() { return features; }

    @Override
    public double predictProba(double[] x) {
        double sum = 0;
        for (FlatTree t : trees) sum += t.eval(x);
        return sum / trees.size();
    }

    @Override
    public double[] featureImportances() {
        return importances.clone();
    }

    private static final class FlatTree {
        final int[] feature;
        final double[] threshold;
        final int[] left;
        final int[] right;
        final double[] value;

        private FlatTree(int n) {
            feature = new int[n];
            threshold = new double[n];
            left = new int[n];
            right = new int[n];
            value = new double[n];
        }

        static FlatTree of(ModelArtifact.Tree tree, int featureCount) {
            List<ModelArtifact.Node> nodes = tree.getNodes();
            if (nodes == null || nodes.isEmpty()) throw new IllegalArgumentException("empty tree");
            FlatTree t = new FlatTree(nodes.size());
            for (int i = 0; i < nodes.size(); i++) {
                ModelArtifact.Node n = nodes.get(i);
                t.feature[i] = n.getFeature();
                t.threshold[i] = n.getThreshold();
                t.left[i] = n.getLeft();
                t.right[i] = n.getRight();
                t.value[i] = n.getValue();
                if (n.getFeature() >= 0) {
                    if (n.getFeature() >= featureCount) throw new IllegalArgumentException("node " + i + " splits on unknown column " + n.getFeature());
                    // children must come after the parent, which also rules out cycles
                    if (n.getLeft() <= i || n.getRight() <= i || n.getLeft() >= nodes.size() || n.getRight() >= nodes.size()) {
                        throw new IllegalArgumentException("node " + i + " has invalid children");
                    }
                } else if (n.getValue() < 0 || n.getValue() > 1) {
                    throw new IllegalArgumentException("leaf " + i + " value outside [0,1]");
                }
            }
            return t;
        }

        double eval(double[] x) {
            int i = 0;
            while (feature[i] >= 0) {
                i = x[feature[i]] <= threshold[i] ? left[i] : right[i];
            }
            return value[i];
        }

        void countSplits(double[] counts) {
            for (int f : feature) {
                if (f >= 0) counts[f] += 1;
            }
        }
    }
}
