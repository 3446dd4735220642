package com.demo.churn.service.features;

import com.demo.churn.common.Result;
import com.demo.churn.model.CustomerRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrator: runs every provider on a validated record, merges their columns and lays
 * them out in {@link FeatureSchema#MODEL_FEATURES} order.
 *
 * <p>Failures here mean the validator let through something the providers cannot encode,
 * i.e. a defect. They are logged at ERROR and returned as an {@code ENCODING_ERROR} result,
 * never replaced by a default value.</p>
 */
@Slf4j
public class FeatureEncoder {

    public static final String ENCODING_ERROR = "ENCODING_ERROR";

    private final List<FeatureProvider> providers;
    private final List<String> schema;

    public FeatureEncoder(List<FeatureProvider> providers) {
        this(providers, FeatureSchema.MODEL_FEATURES);
    }

    public FeatureEncoder(List<FeatureProvider> providers, List<String> schema) {
        this.providers = List.copyOf(providers);
        this.schema = List.copyOf(schema);
    }

    public List<String> schema() {
        return schema;
    }

    public Result<FeatureVector> encode(CustomerRecord record) {
        Map<String, Double> merged = new LinkedHashMap<>();
        for (FeatureProvider p : providers) {
            Map<String, Double> part;
            try {
                part = p.compute(record);
            } catch (RuntimeException e) {
                log.error("Encoding contract violated by {} for customer {}: {}",
                        p.getClass().getSimpleName(), record.getCustomerId(), e.toString());
                return Result.fail(ENCODING_ERROR, p.getClass().getSimpleName() + ": " + e);
            }
            if (!part.keySet().equals(p.columns())) {
                log.error("{} produced columns {} but declares {}", p.getClass().getSimpleName(), part.keySet(), p.columns());
                return Result.fail(ENCODING_ERROR, p.getClass().getSimpleName() + " produced undeclared or missing columns");
            }
            for (Map.Entry<String, Double> e : part.entrySet()) {
                if (merged.putIfAbsent(e.getKey(), e.getValue()) != null) {
                    log.error("Column {} produced by more than one provider", e.getKey());
                    return Result.fail(ENCODING_ERROR, "duplicate column " + e.getKey());
                }
            }
        }

        List<String> missing = new ArrayList<>();
        double[] values = new double[schema.size()];
        for (int i = 0; i < schema.size(); i++) {
            Double v = merged.get(schema.get(i));
            if (v == null || !Double.isFinite(v)) {
                missing.add(schema.get(i));
            } else {
                values[i] = v;
            }
        }
        if (!missing.isEmpty() || merged.size() != schema.size()) {
            List<String> unexpected = new ArrayList<>(merged.keySet());
            unexpected.removeAll(schema);
            log.error("Encoded columns do not match the model schema. missing={} unexpected={}", missing, unexpected);
            return Result.fail(ENCODING_ERROR, "missing columns " + missing + ", unexpected columns " + unexpected);
        }
        return Result.ok(new FeatureVector(schema, values));
    }
}
