package com.demo.churn.service;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.exception.PredictionException;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.features.FeatureVector;
import com.demo.churn.service.model.ChurnClassifier;
import com.demo.churn.service.model.ModelRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/** Scores encoded vectors with the shared classifier. Read-only, safe for concurrent callers. */
@Service
public class ChurnPredictor {

    private final ModelRegistry models;
    private final RiskLevelPolicy riskPolicy;
    private final double decisionThreshold;
    private final Clock clock;

    public ChurnPredictor(ModelRegistry models, ChurnProperties props, Clock clock) {
        this.models = models;
        this.riskPolicy = RiskLevelPolicy.from(props.getRisk());
        this.decisionThreshold = props.getModel().getDecisionThreshold();
        this.clock = clock;
    }

    public PredictionResult predict(CustomerRecord record, FeatureVector vector) {
        ChurnClassifier model = models.get();
        if (vector.size() != model.features().size()) {
            throw new PredictionException("Vector has " + vector.size() + " columns, model expects " + model.features().size());
        }
        double p;
        try {
            p = model.predictProba(vector.toArray());
        } catch (RuntimeException e) {
            throw new PredictionException("Model evaluation failed: " + e.getMessage(), e);
        }
        if (!Double.isFinite(p) || p < 0 || p > 1) {
            throw new PredictionException("Model returned an invalid probability: " + p);
        }
        return PredictionResult.builder()
                .predictionId(UUID.randomUUID())
                .record(record)
                .features(vector)
                .probability(p)
                .churn(p >= decisionThreshold)
                .riskLevel(riskPolicy.classify(p))
                .confidence(confidence(p, decisionThreshold))
                .modelVersion(model.version())
                .predictedAt(clock.instant())
                .build();
    }

    public RiskLevelPolicy riskPolicy() {
        return riskPolicy;
    }

    static double confidence(double p, double threshold) {
        double span = Math.max(threshold, 1 - threshold);
        return Math.min(1.0, Math.abs(p - threshold) / span);
    }
}
