package com.demo.churn.service.monitoring;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.service.dto.PredictionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Rolling statistics of the scoring pipeline. The open window is the only shared mutable
 * state: every update goes through {@link #lock}, and {@link #snapshot()} only swaps the
 * window under that lock before computing metrics and drift on the closed copy.
 */
@Slf4j
@Component
public class PredictionMonitor {

    private final ChurnProperties.Monitoring cfg;
    private final Clock clock;
    private final ReferenceDistributionProvider reference;

    private final Object lock = new Object();
    private final Random rnd;
    private WindowAccumulator window;
    /** predictionId -> predicted churn, for joining ground truth that arrives later. */
    private final Map<UUID, Boolean> recent;

    private final Object snapshotLock = new Object();
    private final Deque<MonitoringSnapshot> history = new ArrayDeque<>();

    public PredictionMonitor(ChurnProperties props, Clock clock, ReferenceDistributionProvider reference) {
        this.cfg = props.getMonitoring();
        this.clock = clock;
        this.reference = reference;
        this.rnd = new Random(cfg.getSamplingSeed());
        this.window = new WindowAccumulator(clock.instant(), cfg.getMaxWindowSamples(), rnd);
        int capacity = cfg.getRecentPredictions();
        this.recent = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    public void record(PredictionResult prediction) {
        synchronized (lock) {
            window.add(prediction);
            recent.put(prediction.getPredictionId(), prediction.isChurn());
        }
    }

    /**
     * Joins an observed outcome to a recent prediction. Returns false when the prediction
     * is unknown (never recorded, already labelled, or evicted).
     */
    public boolean recordOutcome(UUID predictionId, boolean churned) {
        synchronized (lock) {
            Boolean predicted = recent.remove(predictionId);
            if (predicted == null) {
                log.warn("Outcome for unknown prediction {} ignored", predictionId);
                return false;
            }
            window.addOutcome(predicted, churned);
            return true;
        }
    }

    public long currentVolume() {
        synchronized (lock) {
            return window.volume;
        }
    }

    /** Closes the open window into a snapshot and appends it to the bounded history. */
    public MonitoringSnapshot snapshot() {
        synchronized (snapshotLock) {
            WindowAccumulator closed;
            Instant end;
            synchronized (lock) {
                end = clock.instant();
                closed = window;
                window = new WindowAccumulator(end, cfg.getMaxWindowSamples(), rnd);
            }

            DriftResult drift = closed.volume == 0 ? DriftResult.NONE : drift(closed.samples());
            MonitoringSnapshot s = MonitoringSnapshot.builder()
                    .windowStart(closed.start)
                    .windowEnd(end)
                    .volume(closed.volume)
                    .churnCount(closed.churnCount)
                    .churnRate(closed.volume == 0 ? null : (double) closed.churnCount / closed.volume)
                    .meanProbability(closed.volume == 0 ? null : closed.probabilitySum / closed.volume)
                    .highRiskCount(closed.highRiskCount)
                    .riskDistribution(new EnumMap<>(closed.riskCounts))
                    .confusion(closed.confusion)
                    .performance(PerformanceMetrics.from(closed.confusion))
                    .driftScore(drift.score())
                    .featureDrift(drift.featureScores())
                    .driftBasis(drift.basis())
                    .modelVersion(closed.modelVersion)
                    .build();

            synchronized (history) {
                history.addLast(s);
                evict(end);
            }
            log.info("Monitoring window closed: volume={} churnRate={} drift={} labelled={}",
                    s.getVolume(), s.getChurnRate(), s.getDriftScore(), s.getConfusion().total());
            return s;
        }
    }

    /** Drift of the open window against the reference. */
    public DriftResult driftScore() {
        List<WindowAccumulator.Sample> samples;
        synchronized (lock) {
            samples = window.samples();
        }
        return samples.isEmpty() ? DriftResult.NONE : drift(samples);
    }

    /**
     * Drift of the given window against the reference: maximum per-feature PSI, or the PSI of
     * the probabilities when no feature vectors are given.
     */
    public DriftResult driftScore(List<double[]> vectors, double[] probabilities) {
        ReferenceDistribution ref = reference.get();
        if (!vectors.isEmpty()) {
            Map<String, Double> perFeature = new LinkedHashMap<>();
            double max = 0;
            for (int j = 0; j < ref.features().size(); j++) {
                double[] column = new double[vectors.size()];
                for (int i = 0; i < column.length; i++) column[i] = vectors.get(i)[j];
                double psi = DriftCalculator.psi(ref.featureBins(j), column);
                perFeature.put(ref.features().get(j), psi);
                max = Math.max(max, psi);
            }
            return new DriftResult(max, perFeature, "features");
        }
        if (probabilities.length > 0) {
            return new DriftResult(DriftCalculator.psi(ref.probabilityBins(), probabilities), Map.of(), "probability");
        }
        return DriftResult.NONE;
    }

    public List<MonitoringSnapshot> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public TrailingSummary trailingSummary() {
        List<MonitoringSnapshot> snaps = history();
        long volume = 0, churn = 0, highRisk = 0;
        ConfusionCounts confusion = ConfusionCounts.EMPTY;
        Double maxDrift = null;
        for (MonitoringSnapshot s : snaps) {
            volume += s.getVolume();
            churn += s.getChurnCount();
            highRisk += s.getHighRiskCount();
            confusion = confusion.plus(s.getConfusion());
            if (s.getDriftScore() != null) {
                maxDrift = maxDrift == null ? s.getDriftScore() : Math.max(maxDrift, s.getDriftScore());
            }
        }
        return new TrailingSummary(
                snaps.isEmpty() ? null : snaps.get(0).getWindowStart(),
                snaps.isEmpty() ? null : snaps.get(snaps.size() - 1).getWindowEnd(),
                snaps.size(), volume, churn,
                volume == 0 ? null : (double) churn / volume,
                highRisk, confusion, PerformanceMetrics.from(confusion), maxDrift);
    }

    private DriftResult drift(List<WindowAccumulator.Sample> samples) {
        List<double[]> vectors = new ArrayList<>(samples.size());
        double[] probabilities = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            WindowAccumulator.Sample s = samples.get(i);
            if (s.vector() != null) vectors.add(s.vector());
            probabilities[i] = s.probability();
        }
        try {
            // mixed windows fall back to probabilities, which every sample has
            return driftScore(vectors.size() == samples.size() ? vectors : List.of(), probabilities);
        } catch (RuntimeException e) {
            log.warn("Drift not computed: {}", e.getMessage());
            return DriftResult.NONE;
        }
    }

    private void evict(Instant now) {
        Instant horizon = now.minus(cfg.getWindow());
        while (!history.isEmpty() && history.peekFirst().getWindowEnd().isBefore(horizon)) {
            history.removeFirst();
        }
        while (history.size() > cfg.getMaxHistory()) {
            history.removeFirst();
        }
    }
}
