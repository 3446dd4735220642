package com.demo.churn.service.batch;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.model.Country;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.model.CustomerTier;
import com.demo.churn.model.Gender;
import com.demo.churn.model.RiskLevel;
import com.demo.churn.service.ChurnScoringService;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.dto.ScoringOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Fans the scoring pipeline over many records on the batch worker pool.
 *
 * <p>Rows are independent: a row that fails validation, encoding or prediction becomes a
 * failed outcome and the others go on. Segment totals are merged per finished row with
 * {@link SegmentStats#combine}.</p>
 */
@Slf4j
@Service
public class BatchProcessor {

    private final ChurnScoringService scoring;
    private final BatchJobRegistry registry;
    private final Executor executor;
    private final Clock clock;
    private final int maxRows;
    private final Map<String, Function<CustomerRecord, String>> segmentKeys;

    public BatchProcessor(ChurnScoringService scoring, BatchJobRegistry registry,
                          @Qualifier("batchExecutor") Executor executor, ChurnProperties props, Clock clock) {
        this.scoring = scoring;
        this.registry = registry;
        this.executor = executor;
        this.clock = clock;
        this.maxRows = props.getBatch().getMaxRows();
        this.segmentKeys = segmentExtractors(props.getBatch().getSegmentKeys());
    }

    /** Scores every record and waits for the report. */
    public BatchReport process(List<CustomerRecord> records, String locale) {
        return process(records, locale, BatchProgressListener.NONE);
    }

    public BatchReport process(List<CustomerRecord> records, String locale, BatchProgressListener listener) {
        BatchJob job = start(records, locale, listener);
        return job.completion().join();
    }

    /** Starts a job in the background and registers it for polling. */
    public BatchJob submit(List<CustomerRecord> records, String locale, BatchProgressListener listener) {
        BatchJob job = start(records, locale, listener);
        registry.register(job);
        log.info("Batch job {} submitted with {} records", job.getId(), job.getTotal());
        return job;
    }

    public BatchJob job(String id) {
        return registry.get(id);
    }

    public List<BatchJob> jobs() {
        return registry.list();
    }

    public BatchJob cancel(String id) {
        BatchJob job = registry.get(id);
        if (job.cancel()) {
            log.info("Batch job {} cancellation requested at {}/{}", id, job.getDone(), job.getTotal());
        }
        return job;
    }

    private BatchJob start(List<CustomerRecord> records, String locale, BatchProgressListener listener) {
        if (records.size() > maxRows) {
            throw new IllegalArgumentException("Batch of " + records.size() + " rows exceeds the limit of " + maxRows);
        }
        Instant startedAt = clock.instant();
        BatchJob job = new BatchJob(UUID.randomUUID().toString(), records.size(), startedAt);
        AtomicReferenceArray<BatchRecordOutcome> outcomes = new AtomicReferenceArray<>(records.size());
        Map<String, ConcurrentHashMap<String, SegmentStats>> segments = new LinkedHashMap<>();
        segmentKeys.keySet().forEach(k -> segments.put(k, new ConcurrentHashMap<>()));

        CompletableFuture<?>[] tasks = new CompletableFuture<?>[records.size()];
        for (int i = 0; i < records.size(); i++) {
            int index = i;
            CustomerRecord record = records.get(i);
            tasks[i] = CompletableFuture.runAsync(() -> {
                BatchRecordOutcome outcome = job.isCancelRequested()
                        ? BatchRecordOutcome.skipped(index + 1, record == null ? null : record.getCustomerId())
                        : scoreRow(index + 1, record, locale, segments);
                outcomes.set(index, outcome);
                int done = job.advance();
                try {
                    listener.onProgress(job.getId(), done, job.getTotal());
                } catch (RuntimeException e) {
                    log.warn("Progress listener failed for job {}: {}", job.getId(), e.toString());
                }
            }, executor);
        }

        CompletableFuture.allOf(tasks).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Batch job {} aborted: {}", job.getId(), error.toString());
                job.completion().completeExceptionally(error);
                return;
            }
            BatchReport report;
            try {
                report = report(job, outcomes, segments, startedAt);
            } catch (RuntimeException e) {
                log.error("Batch job {} report could not be built: {}", job.getId(), e.toString());
                job.completion().completeExceptionally(e);
                return;
            }
            log.info("Batch job {} finished: {} succeeded, {} failed, {} skipped",
                    job.getId(), report.getSucceeded(), report.getFailed(), report.getSkipped());
            job.completion().complete(report);
        });
        return job;
    }

    private BatchRecordOutcome scoreRow(int rowIndex, CustomerRecord record,
                                        String locale, Map<String, ConcurrentHashMap<String, SegmentStats>> segments) {
        ScoringOutcome outcome;
        try {
            outcome = scoring.score(record, locale);
        } catch (RuntimeException e) {
            log.error("Row {} could not be scored: {}", rowIndex, e.toString());
            outcome = ScoringOutcome.failed(record, ScoringOutcome.FailureKind.PREDICTION, e.getMessage(), List.of());
        }
        if (!outcome.isSuccess()) {
            log.debug("Row {} failed ({}): {}", rowIndex, outcome.getFailure(), outcome.getError());
        } else {
            PredictionResult p = outcome.getPrediction();
            SegmentStats one = SegmentStats.of(p.getProbability(), p.isChurn());
            segmentKeys.forEach((key, extractor) ->
                    segments.get(key).merge(extractor.apply(record), one, SegmentStats::combine));
        }
        return BatchRecordOutcome.of(rowIndex, outcome);
    }

    private BatchReport report(BatchJob job, AtomicReferenceArray<BatchRecordOutcome> outcomes,
                               Map<String, ConcurrentHashMap<String, SegmentStats>> segments, Instant startedAt) {
        List<BatchRecordOutcome> ordered = new ArrayList<>(outcomes.length());
        Map<RiskLevel, Long> histogram = new EnumMap<>(RiskLevel.class);
        for (RiskLevel r : RiskLevel.values()) histogram.put(r, 0L);
        int succeeded = 0, failed = 0, skipped = 0;
        long churners = 0;
        double probabilitySum = 0;
        for (int i = 0; i < outcomes.length(); i++) {
            BatchRecordOutcome o = outcomes.get(i);
            ordered.add(o);
            switch (o.getStatus()) {
                case SUCCEEDED:
                    succeeded++;
                    histogram.merge(o.getPrediction().getRiskLevel(), 1L, Long::sum);
                    if (o.getPrediction().isChurn()) churners++;
                    probabilitySum += o.getPrediction().getProbability();
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    skipped++;
            }
        }
        Map<String, Map<String, SegmentStats>> segmentView = new LinkedHashMap<>();
        segments.forEach((k, v) -> segmentView.put(k, new TreeMap<>(v)));
        return BatchReport.builder()
                .jobId(job.getId())
                .total(job.getTotal())
                .succeeded(succeeded)
                .failed(failed)
                .skipped(skipped)
                .cancelled(job.isCancelRequested())
                .outcomes(ordered)
                .riskHistogram(histogram)
                .churnRate(succeeded == 0 ? null : (double) churners / succeeded)
                .meanProbability(succeeded == 0 ? null : probabilitySum / succeeded)
                .segments(segmentView)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .build();
    }

    private static Map<String, Function<CustomerRecord, String>> segmentExtractors(List<String> keys) {
        Map<String, Function<CustomerRecord, String>> out = new LinkedHashMap<>();
        for (String key : keys) {
            switch (key.trim().toLowerCase(Locale.ROOT)) {
                case "country":
                    out.put("country", r -> Country.fromLabel(r.getCountry()).map(Country::getLabel).orElse("unknown"));
                    break;
                case "tier":
                case "category":
                    out.put("tier", r -> CustomerTier.fromLabel(r.getTier()).map(Enum::name).orElse("unknown"));
                    break;
                case "gender":
                    out.put("gender", r -> Gender.fromLabel(r.getGender()).map(Gender::getLabel).orElse("unknown"));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported batch segment key '" + key + "'");
            }
        }
        return out;
    }
}
