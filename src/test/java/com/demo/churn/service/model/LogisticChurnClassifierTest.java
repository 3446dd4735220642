package com.demo.churn.service.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LogisticChurnClassifierTest {

    private static final List<String> FEATURES = List.of("a", "b");

    @Test
    void appliesStandardizationBeforeTheLinearTerm() {
        LogisticChurnClassifier c = new LogisticChurnClassifier("v1", FEATURES, 0.5,
                new double[]{2.0, -1.0}, new double[]{10, 0}, new double[]{5, 2}, null);

        // z = 0.5 + 2 * (15 - 10) / 5 - 1 * (4 - 0) / 2 = 0.5
        double expected = 1.0 / (1.0 + Math.exp(-0.5));
        assertThat(c.predictProba(new double[]{15, 4})).isCloseTo(expected, within(1e-12));
    }

    @Test
    void zeroScaleIsTreatedAsOne() {
        LogisticChurnClassifier c = new LogisticChurnClassifier("v1", FEATURES, 0.0,
                new double[]{1.0, 0.0}, null, new double[]{0, 1}, null);

        assertThat(c.predictProba(new double[]{2, 0})).isCloseTo(1.0 / (1.0 + Math.exp(-2)), within(1e-12));
    }

    @Test
    void importancesDefaultToNormalizedAbsoluteCoefficients() {
        LogisticChurnClassifier c = new LogisticChurnClassifier("v1", FEATURES, 0.0,
                new double[]{3.0, -1.0}, null, null, null);

        assertThat(c.featureImportances()).containsExactly(0.75, 0.25);
    }

    @Test
    void declaredImportancesAreNormalized() {
        LogisticChurnClassifier c = new LogisticChurnClassifier("v1", FEATURES, 0.0,
                new double[]{3.0, -1.0}, null, null, new double[]{2, 2});

        assertThat(c.featureImportances()).containsExactly(0.5, 0.5);
    }

    @Test
    void rejectsMismatchedLengths() {
        assertThatThrownBy(() -> new LogisticChurnClassifier("v1", FEATURES, 0.0, new double[]{1}, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LogisticChurnClassifier("v1", FEATURES, 0.0, new double[]{1, 1}, new double[]{0}, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
