package com.demo.churn.service.explain;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.exception.ExplanationUnavailableException;
import com.demo.churn.service.dto.ExplanationResult;
import com.demo.churn.service.dto.FeatureContribution;
import com.demo.churn.service.dto.FeatureContribution.Direction;
import com.demo.churn.service.dto.FeatureContribution.Magnitude;
import com.demo.churn.service.dto.ImportanceComparison;
import com.demo.churn.service.dto.PredictionResult;
import com.demo.churn.service.model.ChurnClassifier;
import com.demo.churn.service.model.ModelRegistry;
import com.demo.churn.service.model.ModelReloadedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decomposes a prediction into per-feature contributions and phrases the top ones.
 *
 * <p>The attribution context (classifier, background sample, baseline) is built on first
 * use and reused until an explicit model reload. If the exact attributor fails for a
 * request, that request is answered with the approximate one instead.</p>
 */
@Slf4j
@Service
public class ExplainService {

    private final ModelRegistry models;
    private final BackgroundSampleProvider backgroundProvider;
    private final FeatureAttributor primary;
    private final FeatureAttributor fallback = new GlobalImportanceAttributor();
    private final ReasonCatalog catalog = new ReasonCatalog();
    private final ChurnProperties props;
    private final MeterRegistry meters;

    private final Object lock = new Object();
    private volatile AttributionContext context;

    public ExplainService(ModelRegistry models, BackgroundSampleProvider backgroundProvider,
                          FeatureAttributor featureAttributor, ChurnProperties props, MeterRegistry meters) {
        this.models = models;
        this.backgroundProvider = backgroundProvider;
        this.primary = featureAttributor;
        this.props = props;
        this.meters = meters;
        log.info("Explainer attribution method: {} (exact={})", primary.method(), primary.isExact());
    }

    public ExplanationResult explain(PredictionResult prediction, String locale) {
        Locale lc = ReasonCatalog.resolve(locale);
        AttributionContext ctx = context();
        if (!ctx.model().version().equals(prediction.getModelVersion())) {
            log.warn("Prediction {} was scored by model {} but is explained with {}",
                    prediction.getPredictionId(), prediction.getModelVersion(), ctx.model().version());
        }
        double[] x = prediction.getFeatures().toArray();

        Attribution attribution;
        Timer.Sample sample = Timer.start(meters);
        try {
            attribution = primary.attribute(ctx, x);
        } catch (ExplanationUnavailableException e) {
            log.warn("Exact attribution unavailable for prediction {}, using {}: {}",
                    prediction.getPredictionId(), fallback.method(), e.getMessage());
            attribution = fallback.attribute(ctx, x);
        }
        sample.stop(meters.timer("churn.explanation", "method", attribution.method()));

        List<FeatureContribution> ranked = rank(ctx.model().features(), x, attribution.contributions());
        int k = Math.max(1, Math.min(props.getExplainer().getTopK(), ranked.size()));
        List<FeatureContribution> top = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            FeatureContribution c = ranked.get(i);
            top.add(c.toBuilder()
                    .title(catalog.title(lc, c.getFeature()))
                    .text(catalog.factorText(lc, c.getFeature(), c.getValue(), c.getContribution(), c.getDirection(), c.getMagnitude()))
                    .build());
        }

        StringBuilder summary = new StringBuilder(catalog.headline(lc, attribution.finalValue(),
                prediction.getRiskLevel(), attribution.baseline(), !attribution.exact()));
        for (FeatureContribution c : top) summary.append(' ').append(c.getText());

        return ExplanationResult.builder()
                .predictionId(prediction.getPredictionId())
                .customerId(prediction.getRecord() == null ? null : prediction.getRecord().getCustomerId())
                .method(attribution.method())
                .approximate(!attribution.exact())
                .baselineValue(attribution.baseline())
                .finalValue(attribution.finalValue())
                .contributions(ranked)
                .topFactors(top)
                .summary(summary.toString())
                .recommendedActions(actions(lc, top))
                .locale(lc.getLanguage())
                .modelVersion(ctx.model().version())
                .build();
    }

    /**
     * Global importance of the classifier next to the mean absolute contribution over the
     * first {@code sampleSize} background rows. The latter is null without exact attribution.
     */
    public ImportanceComparison importance(int sampleSize) {
        AttributionContext ctx = context();
        ChurnClassifier model = ctx.model();
        double[] global = model.featureImportances();
        Map<String, Double> modelImportance = new LinkedHashMap<>();
        for (int i = 0; i < global.length; i++) modelImportance.put(model.features().get(i), global[i]);

        Map<String, Double> meanAbs = null;
        if (primary.isExact() && ctx.hasBackground()) {
            int n = Math.min(Math.max(1, sampleSize), ctx.background().size());
            double[] acc = new double[global.length];
            for (int r = 0; r < n; r++) {
                double[] phi = primary.attribute(ctx, ctx.background().row(r)).contributions();
                for (int j = 0; j < phi.length; j++) acc[j] += Math.abs(phi[j]);
            }
            meanAbs = new LinkedHashMap<>();
            for (int j = 0; j < acc.length; j++) meanAbs.put(model.features().get(j), acc[j] / n);
        }
        return new ImportanceComparison(model.version(), modelImportance, meanAbs);
    }

    public boolean isExact() {
        return primary.isExact();
    }

    @EventListener
    public void onModelReloaded(ModelReloadedEvent event) {
        synchronized (lock) {
            context = null;
            backgroundProvider.invalidate();
        }
        log.info("Explainer context dropped after model reload to {}", event.currentVersion());
    }

    AttributionContext context() {
        AttributionContext ctx = context;
        if (ctx != null) return ctx;
        synchronized (lock) {
            if (context == null) {
                context = buildContext(models.get());
            }
            return context;
        }
    }

    private AttributionContext buildContext(ChurnClassifier model) {
        try {
            AttributionContext ctx = AttributionContext.of(model, backgroundProvider.get());
            log.info("Explainer context built for model {}: baseline={} over {} background rows",
                    model.version(), String.format(Locale.ROOT, "%.4f", ctx.baseline()), ctx.background().size());
            return ctx;
        } catch (RuntimeException e) {
            double baseline = props.getModel().getDecisionThreshold();
            log.warn("Background sample unavailable ({}), baseline falls back to {}", e.getMessage(), baseline);
            return AttributionContext.withoutBackground(model, baseline);
        }
    }

    private List<FeatureContribution> rank(List<String> features, double[] x, double[] phi) {
        double minorBelow = props.getExplainer().getMinorBelow();
        double majorAbove = props.getExplainer().getMajorAbove();
        List<FeatureContribution> out = new ArrayList<>(phi.length);
        for (int i = 0; i < phi.length; i++) {
            double abs = Math.abs(phi[i]);
            Magnitude magnitude = abs < minorBelow ? Magnitude.MINOR : abs < majorAbove ? Magnitude.MODERATE : Magnitude.MAJOR;
            out.add(FeatureContribution.builder()
                    .feature(features.get(i))
                    .value(x[i])
                    .contribution(phi[i])
                    .absContribution(abs)
                    .direction(direction(phi[i]))
                    .magnitude(magnitude)
                    .build());
        }
        // stable sort: equal magnitudes keep schema order
        out.sort(Comparator.comparingDouble(FeatureContribution::getAbsContribution).reversed());
        return out;
    }

    private static Direction direction(double contribution) {
        if (contribution > 0) return Direction.INCREASES;
        return contribution < 0 ? Direction.DECREASES : Direction.NEUTRAL;
    }

    private List<String> actions(Locale lc, List<FeatureContribution> top) {
        Set<String> out = new LinkedHashSet<>();
        for (FeatureContribution c : top) {
            if (c.getMagnitude() == Magnitude.MINOR) continue;
            String a = catalog.action(lc, c.getFeature(), c.getDirection());
            if (a != null) out.add(a);
        }
        if (out.isEmpty()) out.add(catalog.stableProfileAction(lc));
        return new ArrayList<>(out);
    }
}
