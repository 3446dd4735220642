package com.demo.churn.service.monitoring;

import com.demo.churn.model.RiskLevel;
import com.demo.churn.service.dto.PredictionResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Running totals of the open monitoring window. Not thread-safe: only touched under the
 * monitor's lock while open, and only read once it has been swapped out.
 */
class WindowAccumulator {

    /** One retained observation; {@code vector} is null when the prediction carried none. */
    record Sample(double[] vector, double probability) {
    }

    final Instant start;
    long volume;
    long churnCount;
    long highRiskCount;
    double probabilitySum;
    /** Version of the model behind the latest prediction of the window. */
    String modelVersion;
    final Map<RiskLevel, Long> riskCounts = new EnumMap<>(RiskLevel.class);
    ConfusionCounts confusion = ConfusionCounts.EMPTY;

    private final int capacity;
    private final Random rnd;
    private final List<Sample> reservoir = new ArrayList<>();

    WindowAccumulator(Instant start, int capacity, Random rnd) {
        this.start = start;
        this.capacity = capacity;
        this.rnd = rnd;
        for (RiskLevel r : RiskLevel.values()) riskCounts.put(r, 0L);
    }

    void add(PredictionResult p) {
        volume++;
        if (p.isChurn()) churnCount++;
        if (p.getRiskLevel() == RiskLevel.HIGH) highRiskCount++;
        probabilitySum += p.getProbability();
        modelVersion = p.getModelVersion();
        riskCounts.merge(p.getRiskLevel(), 1L, Long::sum);

        Sample s = new Sample(p.getFeatures() == null ? null : p.getFeatures().toArray(), p.getProbability());
        // reservoir sampling (algorithm R)
        if (reservoir.size() < capacity) {
            reservoir.add(s);
        } else {
            long j = (long) (rnd.nextDouble() * volume);
            if (j < capacity) reservoir.set((int) j, s);
        }
    }

    void addOutcome(boolean predicted, boolean actual) {
        confusion = confusion.plus(predicted, actual);
    }

    List<Sample> samples() {
        return List.copyOf(reservoir);
    }
}
