package com.demo.churn.service.batch;

import com.demo.churn.model.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class BatchReport {
    String jobId;
    int total;
    int succeeded;
    int failed;
    /** Rows never started because the job was cancelled. */
    int skipped;
    boolean cancelled;
    /** One entry per input row, in input order. */
    List<BatchRecordOutcome> outcomes;
    Map<RiskLevel, Long> riskHistogram;
    /** Share of predicted churners among succeeded rows; null when none succeeded. */
    Double churnRate;
    Double meanProbability;
    /** Segment key (e.g. {@code country}) to segment value to totals. */
    Map<String, Map<String, SegmentStats>> segments;
    Instant startedAt;
    Instant finishedAt;

    public List<BatchRecordOutcome> failures() {
        return outcomes.stream().filter(o -> o.getStatus() == BatchRecordOutcome.Status.FAILED).toList();
    }
}
