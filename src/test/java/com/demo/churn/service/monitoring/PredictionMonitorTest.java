package com.demo.churn.service.monitoring;

import com.demo.churn.MutableClock;
import com.demo.churn.TestFixtures;
import com.demo.churn.config.ChurnProperties;
import com.demo.churn.model.RiskLevel;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.explain.BackgroundSample;
import com.demo.churn.service.explain.BackgroundSampleProvider;
import com.demo.churn.service.features.FeatureSchema;
import com.demo.churn.service.features.FeatureVector;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PredictionMonitorTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final ChurnProperties props = TestFixtures.props();
    private final MutableClock clock = new MutableClock(START);

    private PredictionMonitor monitor() {
        return TestFixtures.monitor(props, clock);
    }

    private static PredictionResult prediction(double p, FeatureVector features) {
        RiskLevel risk = p > 0.7 ? RiskLevel.HIGH : p < 0.3 ? RiskLevel.LOW : RiskLevel.MEDIUM;
        return PredictionResult.builder()
                .predictionId(UUID.randomUUID())
                .features(features)
                .probability(p)
                .churn(p >= 0.5)
                .riskLevel(risk)
                .modelVersion("test-logit")
                .predictedAt(START)
                .build();
    }

    @Test
    void snapshotCountsTheWindow() {
        PredictionMonitor m = monitor();
        m.record(prediction(0.9, null));
        m.record(prediction(0.6, null));
        m.record(prediction(0.2, null));
        m.record(prediction(0.1, null));
        clock.advance(Duration.ofDays(1));

        MonitoringSnapshot s = m.snapshot();

        assertThat(s.getVolume()).isEqualTo(4);
        assertThat(s.getChurnCount()).isEqualTo(2);
        assertThat(s.getChurnRate()).isEqualTo(0.5);
        assertThat(s.getMeanProbability()).isCloseTo(0.45, within(1e-12));
        assertThat(s.getHighRiskCount()).isEqualTo(1);
        assertThat(s.getRiskDistribution()).containsEntry(RiskLevel.LOW, 2L).containsEntry(RiskLevel.MEDIUM, 1L);
        assertThat(s.getWindowStart()).isEqualTo(START);
        assertThat(s.getWindowEnd()).isEqualTo(START.plus(Duration.ofDays(1)));
        assertThat(s.getModelVersion()).isEqualTo("test-logit");
        assertThat(m.currentVolume()).isZero();
    }

    @Test
    void emptyWindowHasNoRatesAndNoDrift() {
        MonitoringSnapshot s = monitor().snapshot();

        assertThat(s.getVolume()).isZero();
        assertThat(s.getChurnRate()).isNull();
        assertThat(s.getDriftScore()).isNull();
        assertThat(s.getDriftBasis()).isEqualTo("none");
        assertThat(s.getPerformance().available()).isFalse();
    }

    @Test
    void performanceIsUnavailableWithoutLabels() {
        PredictionMonitor m = monitor();
        m.record(prediction(0.9, null));

        assertThat(m.snapshot().getPerformance().available()).isFalse();
    }

    @Test
    void outcomesJoinRecentPredictions() {
        PredictionMonitor m = monitor();
        PredictionResult churner = prediction(0.9, null);
        PredictionResult stayer = prediction(0.1, null);
        PredictionResult missed = prediction(0.2, null);
        m.record(churner);
        m.record(stayer);
        m.record(missed);

        assertThat(m.recordOutcome(churner.getPredictionId(), true)).isTrue();
        assertThat(m.recordOutcome(stayer.getPredictionId(), false)).isTrue();
        assertThat(m.recordOutcome(missed.getPredictionId(), true)).isTrue();

        MonitoringSnapshot s = m.snapshot();
        assertThat(s.getConfusion()).isEqualTo(new ConfusionCounts(1, 0, 1, 1));
        assertThat(s.getPerformance().accuracy()).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(s.getPerformance().precision()).isEqualTo(1.0);
        assertThat(s.getPerformance().recall()).isEqualTo(0.5);
    }

    @Test
    void unknownOrRepeatedOutcomesAreRejected() {
        PredictionMonitor m = monitor();
        PredictionResult p = prediction(0.9, null);
        m.record(p);

        assertThat(m.recordOutcome(UUID.randomUUID(), true)).isFalse();
        assertThat(m.recordOutcome(p.getPredictionId(), true)).isTrue();
        assertThat(m.recordOutcome(p.getPredictionId(), true)).isFalse();
    }

    @Test
    void oldestPredictionsAreForgottenForLabelling() {
        props.getMonitoring().setRecentPredictions(2);
        PredictionMonitor m = monitor();
        PredictionResult first = prediction(0.9, null);
        m.record(first);
        m.record(prediction(0.8, null));
        m.record(prediction(0.7, null));

        assertThat(m.recordOutcome(first.getPredictionId(), true)).isFalse();
    }

    @Test
    void inputsLikeTheReferenceDoNotDrift() {
        PredictionMonitor m = monitor();
        BackgroundSample same = BackgroundSampleProvider.generate(500, 42L);
        for (int i = 0; i < same.size(); i++) {
            double[] row = same.row(i);
            m.record(prediction(TestFixtures.logisticModel().predictProba(row), FeatureVector.of(row)));
        }

        MonitoringSnapshot s = m.snapshot();

        assertThat(s.getDriftBasis()).isEqualTo("features");
        assertThat(s.getDriftScore()).isLessThan(0.01);
        assertThat(s.getFeatureDrift()).hasSize(FeatureSchema.size());
    }

    @Test
    void olderCustomersDrift() {
        PredictionMonitor m = monitor();
        BackgroundSample sample = BackgroundSampleProvider.generate(400, 99L);
        int age = FeatureSchema.indexOf(FeatureSchema.AGE);
        for (int i = 0; i < sample.size(); i++) {
            double[] row = sample.row(i);
            row[age] = Math.min(100, row[age] + 25);
            m.record(prediction(0.5, FeatureVector.of(row)));
        }

        DriftResult open = m.driftScore();
        MonitoringSnapshot s = m.snapshot();

        assertThat(open.score()).isGreaterThan(0.25);
        assertThat(s.getDriftScore()).isEqualTo(open.score());
        assertThat(s.getFeatureDrift().get(FeatureSchema.AGE)).isEqualTo(s.getDriftScore());
    }

    @Test
    void probabilitiesAreUsedWithoutVectors() {
        PredictionMonitor m = monitor();
        for (int i = 0; i < 50; i++) m.record(prediction(0.95, null));

        MonitoringSnapshot s = m.snapshot();

        assertThat(s.getDriftBasis()).isEqualTo("probability");
        assertThat(s.getDriftScore()).isGreaterThan(0.25);
        assertThat(s.getFeatureDrift()).isEmpty();
    }

    @Test
    void historyIsBoundedByCountAndAge() {
        props.getMonitoring().setMaxHistory(3);
        PredictionMonitor m = monitor();
        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofDays(1));
            m.snapshot();
        }
        assertThat(m.history()).hasSize(3);

        clock.advance(Duration.ofDays(45));
        MonitoringSnapshot last = m.snapshot();

        assertThat(m.history()).containsExactly(last);
    }

    @Test
    void trailingSummaryAddsUpTheHistory() {
        PredictionMonitor m = monitor();
        PredictionResult p = prediction(0.9, null);
        m.record(p);
        m.recordOutcome(p.getPredictionId(), true);
        m.snapshot();
        m.record(prediction(0.1, null));
        m.record(prediction(0.2, null));
        m.snapshot();

        TrailingSummary t = m.trailingSummary();

        assertThat(t.snapshots()).isEqualTo(2);
        assertThat(t.volume()).isEqualTo(3);
        assertThat(t.churnCount()).isEqualTo(1);
        assertThat(t.confusion().total()).isEqualTo(1);
        assertThat(t.performance().accuracy()).isEqualTo(1.0);
    }
}
