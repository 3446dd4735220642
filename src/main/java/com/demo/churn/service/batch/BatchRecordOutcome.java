package com.demo.churn.service.batch;

import com.demo.churn.service.dto.ExplanationResult;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.dto.ScoringOutcome;
import com.demo.churn.service.validation.FieldViolation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Outcome of one input row; {@code rowIndex} is the 1-based data row number. */
@Value
@Builder
public class BatchRecordOutcome {

    public enum Status { SUCCEEDED, FAILED, SKIPPED }

    int rowIndex;
    String customerId;
    Status status;
    PredictionResult prediction;
    ExplanationResult explanation;
    ScoringOutcome.FailureKind failure;
    String error;
    List<FieldViolation> violations;

    static BatchRecordOutcome of(int rowIndex, ScoringOutcome o) {
        return BatchRecordOutcome.builder()
                .rowIndex(rowIndex)
                .customerId(o.getRecord() == null ? null : o.getRecord().getCustomerId())
                .status(o.isSuccess() ? Status.SUCCEEDED : Status.FAILED)
                .prediction(o.getPrediction())
                .explanation(o.getExplanation())
                .failure(o.getFailure())
                .error(o.getError())
                .violations(o.getViolations())
                .build();
    }

    static BatchRecordOutcome skipped(int rowIndex, String customerId) {
        return BatchRecordOutcome.builder()
                .rowIndex(rowIndex)
                .customerId(customerId)
                .status(Status.SKIPPED)
                .violations(List.of())
                .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
