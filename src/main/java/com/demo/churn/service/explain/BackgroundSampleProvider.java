package com.demo.churn.service.explain;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.service.features.FeatureSchema;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.demo.churn.service.features.FeatureSchema.*;

/**
 * Builds the background reference once and keeps it for the life of the process.
 * The rows come from {@code churn.explainer.background-path} when set, otherwise they are
 * drawn with a fixed seed from the reference marginals of the customer base.
 */
@Slf4j
@Component
public class BackgroundSampleProvider {

    private final ChurnProperties.Explainer cfg;
    private final ResourceLoader resourceLoader;

    private final Object lock = new Object();
    private volatile BackgroundSample sample;

    public BackgroundSampleProvider(ChurnProperties props, ResourceLoader resourceLoader) {
        this.cfg = props.getExplainer();
        this.resourceLoader = resourceLoader;
    }

    public BackgroundSample get() {
        BackgroundSample s = sample;
        if (s != null) return s;
        synchronized (lock) {
            if (sample == null) {
                sample = build();
                log.info("Background sample ready: {} rows from {}", sample.size(), sample.source());
            }
            return sample;
        }
    }

    /** Drops the cached sample; the next {@link #get()} builds it again. */
    public void invalidate() {
        synchronized (lock) {
            sample = null;
        }
    }

    private BackgroundSample build() {
        String path = cfg.getBackgroundPath();
        if (path != null && !path.isBlank()) {
            return load(path);
        }
        return generate(cfg.getBackgroundSize(), cfg.getBackgroundSeed());
    }

    BackgroundSample load(String location) {
        Resource resource = resourceLoader.getResource(location);
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<double[]> rows = new ArrayList<>();
        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> it = mapper.readerFor(Map.class).with(schema).readValues(in)) {
            while (it.hasNext()) {
                Map<String, String> line = it.next();
                double[] r = new double[MODEL_FEATURES.size()];
                for (int j = 0; j < r.length; j++) {
                    String cell = line.get(MODEL_FEATURES.get(j));
                    if (cell == null) {
                        throw new IllegalStateException("background file lacks column '" + MODEL_FEATURES.get(j) + "'");
                    }
                    r[j] = Double.parseDouble(cell.trim());
                }
                rows.add(r);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read background sample " + location, e);
        }
        return new BackgroundSample(MODEL_FEATURES, rows.toArray(new double[0][]), location);
    }

    /**
     * Synthetic rows following the reference marginals. One-hot groups are kept exclusive
     * (a single country, a single tier).
     */
    public static BackgroundSample generate(int n, long seed) {
        Random rnd = new Random(seed);
        double[][] rows = new double[n][FeatureSchema.size()];
        for (int i = 0; i < n; i++) {
            double[] r = rows[i];
            r[indexOf(CREDIT_SCORE)] = Math.rint(clip(650 + 100 * rnd.nextGaussian(), 300, 900));
            r[indexOf(AGE)] = Math.rint(clip(40 + 15 * rnd.nextGaussian(), 18, 100));
            r[indexOf(TENURE)] = Math.rint(clip(exponential(rnd, 5), 0, 20));
            r[indexOf(BALANCE)] = clip(Math.exp(10 + rnd.nextGaussian()), 0, 300_000);
            r[indexOf(PRODUCTS)] = choice(rnd, new double[]{1, 2, 3, 4}, new double[]{0.3, 0.4, 0.2, 0.1});
            r[indexOf(HAS_CARD)] = bernoulli(rnd, 0.7);
            r[indexOf(ACTIVE)] = bernoulli(rnd, 0.8);
            r[indexOf(SALARY)] = clip(75_000 + 25_000 * rnd.nextGaussian(), 0, 300_000);
            r[indexOf(COMPLAIN)] = bernoulli(rnd, 0.2);
            r[indexOf(SATISFACTION)] = choice(rnd, new double[]{1, 2, 3, 4, 5}, new double[]{0.1, 0.1, 0.3, 0.3, 0.2});
            r[indexOf(POINTS)] = Math.rint(clip(exponential(rnd, 1000), 0, 100_000));
            r[indexOf(MALE)] = bernoulli(rnd, 0.5);

            double germany = bernoulli(rnd, 0.3);
            double spain = germany == 1 ? 0 : bernoulli(rnd, 0.3);
            r[indexOf(GERMANY)] = germany;
            r[indexOf(SPAIN)] = spain;

            double platinum = bernoulli(rnd, 0.1);
            double gold = platinum == 1 ? 0 : bernoulli(rnd, 0.2);
            double silver = (platinum == 1 || gold == 1) ? 0 : bernoulli(rnd, 0.3);
            r[indexOf(PLATINUM)] = platinum;
            r[indexOf(GOLD)] = gold;
            r[indexOf(SILVER)] = silver;
        }
        return new BackgroundSample(MODEL_FEATURES, rows, "generated(seed=" + seed + ")");
    }

    private static double clip(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static double exponential(Random rnd, double mean) {
        return -mean * Math.log(1 - rnd.nextDouble());
    }

    private static double bernoulli(Random rnd, double p) {
        return rnd.nextDouble() < p ? 1 : 0;
    }

    private static double choice(Random rnd, double[] values, double[] probs) {
        double u = rnd.nextDouble();
        double acc = 0;
        for (int i = 0; i < values.length; i++) {
            acc += probs[i];
            if (u < acc) return values[i];
        }
        return values[values.length - 1];
    }
}
