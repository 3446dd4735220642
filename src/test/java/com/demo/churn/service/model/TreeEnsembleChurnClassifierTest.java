package com.demo.churn.service.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TreeEnsembleChurnClassifierTest {

    private static final List<String> FEATURES = List.of("age", "complain");

    private static ModelArtifact.Node split(int feature, double threshold, int left, int right) {
        ModelArtifact.Node n = new ModelArtifact.Node();
        n.setFeature(feature);
        n.setThreshold(threshold);
        n.setLeft(left);
        n.setRight(right);
        return n;
    }

    private static ModelArtifact.Node leaf(double value) {
        ModelArtifact.Node n = new ModelArtifact.Node();
        n.setValue(value);
        return n;
    }

    private static ModelArtifact.Tree tree(ModelArtifact.Node... nodes) {
        ModelArtifact.Tree t = new ModelArtifact.Tree();
        t.setNodes(List.of(nodes));
        return t;
    }

    private final ModelArtifact.Tree byAge = tree(split(0, 40, 1, 2), leaf(0.1), leaf(0.6));
    private final ModelArtifact.Tree byComplaint = tree(split(1, 0.5, 1, 2), leaf(0.2), leaf(0.9));

    @Test
    void averagesLeafProbabilities() {
        TreeEnsembleChurnClassifier c = new TreeEnsembleChurnClassifier("t1", FEATURES, List.of(byAge, byComplaint), null);

        assertThat(c.predictProba(new double[]{30, 0})).isCloseTo(0.15, within(1e-12));
        assertThat(c.predictProba(new double[]{50, 1})).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void thresholdGoesLeft() {
        TreeEnsembleChurnClassifier c = new TreeEnsembleChurnClassifier("t1", FEATURES, List.of(byAge), null);

        assertThat(c.predictProba(new double[]{40, 0})).isEqualTo(0.1);
        assertThat(c.predictProba(new double[]{40.01, 0})).isEqualTo(0.6);
    }

    @Test
    void importancesCountSplitsWhenNotDeclared() {
        TreeEnsembleChurnClassifier c = new TreeEnsembleChurnClassifier("t1", FEATURES,
                List.of(byAge, byAge, byAge, byComplaint), null);

        assertThat(c.featureImportances()).containsExactly(0.75, 0.25);
    }

    @Test
    void rejectsChildrenPointingBackwards() {
        ModelArtifact.Tree cyclic = tree(split(0, 1, 0, 1), leaf(0.5));

        assertThatThrownBy(() -> new TreeEnsembleChurnClassifier("t1", FEATURES, List.of(cyclic), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid children");
    }

    @Test
    void rejectsLeafOutsideUnitInterval() {
        assertThatThrownBy(() -> new TreeEnsembleChurnClassifier("t1", FEATURES, List.of(tree(leaf(1.5))), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TreeEnsembleChurnClassifier("t1", FEATURES, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
