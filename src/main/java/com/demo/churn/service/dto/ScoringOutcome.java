package com.demo.churn.service.dto;

import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.validation.FieldViolation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of running one record through validation, encoding, prediction and explanation.
 * Either {@code prediction} and {@code explanation} are set, or {@code failure} says which
 * step stopped the record.
 */
@Value
@Builder
public class ScoringOutcome {

    public enum FailureKind { VALIDATION, ENCODING, PREDICTION }

    CustomerRecord record;
    PredictionResult prediction;
    ExplanationResult explanation;
    /** Every violation found, warnings included; empty when the record was not validated. */
    List<FieldViolation> violations;
    FailureKind failure;
    String error;

    public boolean isSuccess() {
        return failure == null;
    }

    public static ScoringOutcome success(CustomerRecord record, PredictionResult prediction,
                                         ExplanationResult explanation, List<FieldViolation> warnings) {
        return ScoringOutcome.builder()
                .record(record)
                .prediction(prediction)
                .explanation(explanation)
                .violations(List.copyOf(warnings))
                .build();
    }

    public static ScoringOutcome failed(CustomerRecord record, FailureKind kind, String error,
                                        List<FieldViolation> violations) {
        return ScoringOutcome.builder()
                .record(record)
                .failure(kind)
                .error(error)
                .violations(List.copyOf(violations))
                .build();
    }
}
