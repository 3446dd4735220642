package com.demo.churn.service.monitoring;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DriftCalculatorTest {

    private static double[] gaussian(int n, double mean, double sd, long seed) {
        Random rnd = new Random(seed);
        double[] d = new double[n];
        for (int i = 0; i < n; i++) d[i] = mean + sd * rnd.nextGaussian();
        return d;
    }

    @Test
    void identicalDistributionHasNoDrift() {
        double[] ref = gaussian(1000, 40, 10, 1);

        double psi = DriftCalculator.psi(DriftCalculator.binning(ref, 10), ref);

        assertThat(psi).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void sameShapeDifferentSampleStaysLow() {
        DriftCalculator.Binning bins = DriftCalculator.binning(gaussian(2000, 40, 10, 1), 10);

        assertThat(DriftCalculator.psi(bins, gaussian(2000, 40, 10, 2))).isLessThan(0.05);
    }

    @Test
    void shiftedDistributionDrifts() {
        DriftCalculator.Binning bins = DriftCalculator.binning(gaussian(2000, 40, 10, 1), 10);

        assertThat(DriftCalculator.psi(bins, gaussian(2000, 55, 10, 2))).isGreaterThan(0.25);
    }

    @Test
    void tiesCollapseBins() {
        double[] binary = new double[100];
        for (int i = 0; i < 30; i++) binary[i] = 1;

        DriftCalculator.Binning bins = DriftCalculator.binning(binary, 10);

        assertThat(bins.bins()).isLessThan(10);
        assertThat(bins.edges()).startsWith(0.0).endsWith(1.0).doesNotHaveDuplicates();
        assertThat(bins.expected()[0]).isCloseTo(0.7, within(1e-12));
        assertThat(bins.expected()[bins.bins() - 1]).isEqualTo(DriftCalculator.EPSILON);
    }

    @Test
    void emptyBinsAreFloored() {
        double[] binary = new double[100];
        for (int i = 0; i < 30; i++) binary[i] = 1;
        DriftCalculator.Binning bins = DriftCalculator.binning(binary, 10);

        double psi = DriftCalculator.psi(bins, new double[]{0, 0, 0, 0});

        assertThat(psi).isFinite().isGreaterThan(1.0);
    }

    @Test
    void valueOnAnEdgeGoesToTheLowerBin() {
        double[] edges = {1, 2, 3};

        assertThat(DriftCalculator.bin(edges, 0.5)).isZero();
        assertThat(DriftCalculator.bin(edges, 1)).isZero();
        assertThat(DriftCalculator.bin(edges, 1.5)).isEqualTo(1);
        assertThat(DriftCalculator.bin(edges, 99)).isEqualTo(3);
    }

    @Test
    void rejectsEmptyInputs() {
        assertThatThrownBy(() -> DriftCalculator.binning(new double[0], 10)).isInstanceOf(IllegalArgumentException.class);
        DriftCalculator.Binning bins = DriftCalculator.binning(new double[]{1, 2, 3}, 2);
        assertThatThrownBy(() -> DriftCalculator.psi(bins, new double[0])).isInstanceOf(IllegalArgumentException.class);
    }
}
