package com.demo.churn.controller.dto;

import com.demo.churn.model.RiskLevel;
import com.demo.churn.service.dto.ExplanationResult;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.dto.ScoringOutcome;
import com.demo.churn.service.validation.FieldViolation;
import com.demo.churn.service.validation.ValidationResult;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class PredictionDtos {

    private PredictionDtos() {}

    public static class PredictionResponse {
        public UUID predictionId;
        public String customerId;
        public double probability;
        public boolean churn;
        public RiskLevel riskLevel;
        public double confidence;
        public String modelVersion;
        public Instant predictedAt;
        public Map<String, Double> features;
        public ExplanationResult explanation;
        public List<FieldViolation> warnings;

        public static PredictionResponse from(ScoringOutcome o) {
            PredictionResult p = o.getPrediction();
            PredictionResponse r = new PredictionResponse();
            r.predictionId = p.getPredictionId();
            r.customerId = o.getRecord().getCustomerId();
            r.probability = p.getProbability();
            r.churn = p.isChurn();
            r.riskLevel = p.getRiskLevel();
            r.confidence = p.getConfidence();
            r.modelVersion = p.getModelVersion();
            r.predictedAt = p.getPredictedAt();
            r.features = p.getFeatures().asMap();
            r.explanation = o.getExplanation();
            r.warnings = o.getViolations();
            return r;
        }
    }

    public static class ValidationResponse {
        public boolean valid;
        public List<FieldViolation> errors;
        public List<FieldViolation> warnings;

        public static ValidationResponse from(ValidationResult v) {
            ValidationResponse r = new ValidationResponse();
            r.valid = v.isValid();
            r.errors = v.errors();
            r.warnings = v.warnings();
            return r;
        }
    }

    public static class OutcomeRequest {
        @NotNull
        public UUID predictionId;
        @NotNull
        public Boolean churned;
    }
}
