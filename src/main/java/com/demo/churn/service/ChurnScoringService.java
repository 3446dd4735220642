package com.demo.churn.service;

import com.demo.churn.common.Result;
import com.demo.churn.exception.ExplanationUnavailableException;
import com.demo.churn.exception.PredictionException;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.dto.ExplanationResult;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.dto.ScoringOutcome;
import com.demo.churn.service.dto.ScoringOutcome.FailureKind;
import com.demo.churn.service.explain.ExplainService;
import com.demo.churn.service.features.FeatureEncoder;
import com.demo.churn.service.features.FeatureVector;
import com.demo.churn.service.monitoring.PredictionMonitor;
import com.demo.churn.service.validation.CustomerValidator;
import com.demo.churn.service.validation.ValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Validator -> encoder -> predictor -> explainer for one record.
 *
 * <p>Record-level problems come back inside the {@link ScoringOutcome}. Only a model that
 * cannot be loaded escapes as an exception. Recording into the monitor is best-effort and
 * never fails the prediction.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChurnScoringService {

    private final CustomerValidator validator;
    private final FeatureEncoder encoder;
    private final ChurnPredictor predictor;
    private final ExplainService explainer;
    private final PredictionMonitor monitor;
    private final MeterRegistry meters;

    public ValidationResult validate(CustomerRecord record) {
        return validator.validate(record);
    }

    public ScoringOutcome score(CustomerRecord record, String locale) {
        ValidationResult validation = validator.validate(record);
        if (!validation.isValid()) {
            log.debug("Record {} rejected: {}", customerId(record), validation.summary());
            count(FailureKind.VALIDATION.name(), "none");
            return ScoringOutcome.failed(record, FailureKind.VALIDATION, validation.summary(), validation.violations());
        }

        Result<FeatureVector> encoded = encoder.encode(record);
        if (encoded.isFailure()) {
            count(FailureKind.ENCODING.name(), "none");
            return ScoringOutcome.failed(record, FailureKind.ENCODING, encoded.getError(), validation.violations());
        }

        PredictionResult prediction;
        ExplanationResult explanation;
        try {
            prediction = predictor.predict(record, encoded.getData());
            explanation = explainer.explain(prediction, locale);
        } catch (PredictionException | ExplanationUnavailableException e) {
            log.error("Scoring failed for record {}: {}", customerId(record), e.getMessage());
            count(FailureKind.PREDICTION.name(), "none");
            return ScoringOutcome.failed(record, FailureKind.PREDICTION, e.getMessage(), validation.violations());
        }

        try {
            monitor.record(prediction);
        } catch (RuntimeException e) {
            log.warn("Monitoring could not record prediction {}: {}", prediction.getPredictionId(), e.toString());
        }
        count("SUCCESS", prediction.getRiskLevel().name());
        return ScoringOutcome.success(record, prediction, explanation, validation.warnings());
    }

    public List<ScoringOutcome> scoreAll(List<CustomerRecord> records, String locale) {
        return records.stream().map(r -> score(r, locale)).toList();
    }

    private void count(String outcome, String risk) {
        meters.counter("churn.predictions", "outcome", outcome, "risk", risk).increment();
    }

    private static String customerId(CustomerRecord record) {
        return record == null || record.getCustomerId() == null ? "<anonymous>" : record.getCustomerId();
    }
}
