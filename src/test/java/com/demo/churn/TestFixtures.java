package com.demo.churn;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.ChurnPredictor;
import com.demo.churn.service.ChurnScoringService;
import com.demo.churn.service.explain.BackgroundSample;
import com.demo.churn.service.explain.BackgroundSampleProvider;
import com.demo.churn.service.explain.ExplainService;
import com.demo.churn.service.explain.PermutationShapAttributor;
import com.demo.churn.service.features.FeatureEncoder;
import com.demo.churn.service.features.FeatureSchema;
import com.demo.churn.service.features.providers.CategoricalFeaturesProvider;
import com.demo.churn.service.features.providers.FlagFeaturesProvider;
import com.demo.churn.service.features.providers.NumericFeaturesProvider;
import com.demo.churn.service.model.ChurnClassifier;
import com.demo.churn.service.model.LogisticChurnClassifier;
import com.demo.churn.service.model.ModelRegistry;
import com.demo.churn.service.monitoring.PredictionMonitor;
import com.demo.churn.service.monitoring.ReferenceDistribution;
import com.demo.churn.service.monitoring.ReferenceDistributionProvider;
import com.demo.churn.service.validation.CustomerValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.util.List;

/** Shared builders for unit tests. */
public final class TestFixtures {

    private TestFixtures() {}

    public static final double[] COEFFICIENTS = {
            -0.06, 0.75, -0.05, 0.15, -0.10, -0.02, -0.45, 0.02, 1.6, -0.25, -0.02, -0.13, 0.35, 0.0, -0.03, -0.02, 0.01};
    public static final double[] MEANS = {
            650, 39, 5, 76000, 1.53, 0.7, 0.52, 100000, 0.2, 3, 600, 0.55, 0.25, 0.25, 0.25, 0.25, 0.25};
    public static final double[] SCALES = {
            100, 10.5, 2.9, 62000, 0.58, 0.46, 0.5, 57500, 0.4, 1.4, 225, 0.5, 0.43, 0.43, 0.43, 0.43, 0.43};

    /** Same parameters as the shipped artifact. */
    public static ChurnClassifier logisticModel() {
        return logisticModel("test-logit", -1.9);
    }

    public static ChurnClassifier logisticModel(String version, double intercept) {
        return new LogisticChurnClassifier(version, FeatureSchema.MODEL_FEATURES, intercept,
                COEFFICIENTS, MEANS, SCALES, null);
    }

    public static ChurnProperties props() {
        return new ChurnProperties();
    }

    public static ModelRegistry registry(ChurnProperties props) {
        return ModelRegistry.preloaded(logisticModel(), props);
    }

    /** A record that passes every validation rule. */
    public static CustomerRecord.CustomerRecordBuilder validRecord() {
        return CustomerRecord.builder()
                .customerId("C-001")
                .age(42)
                .gender("Female")
                .country("Germany")
                .tier("GOLD")
                .creditScore(620)
                .tenure(3)
                .balance(120_000.0)
                .estimatedSalary(85_000.0)
                .productCount(2)
                .loyaltyPoints(450)
                .hasCreditCard(true)
                .activeMember(false)
                .hasComplaint(true)
                .satisfactionScore(2);
    }

    public static FeatureEncoder encoder() {
        return new FeatureEncoder(List.of(
                new NumericFeaturesProvider(), new FlagFeaturesProvider(), new CategoricalFeaturesProvider()));
    }

    /** Drift reference over the generated background, scored with {@link #logisticModel()}. */
    public static ReferenceDistribution reference(int rows) {
        BackgroundSample bg = BackgroundSampleProvider.generate(rows, 42L);
        ChurnClassifier model = logisticModel();
        double[][] data = new double[bg.size()][];
        double[] probabilities = new double[bg.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = bg.row(i);
            probabilities[i] = model.predictProba(data[i]);
        }
        return ReferenceDistribution.of(bg.features(), data, probabilities, 10);
    }

    public static PredictionMonitor monitor(ChurnProperties props, Clock clock) {
        return new PredictionMonitor(props, clock, ReferenceDistributionProvider.fixed(reference(500)));
    }

    /** Full scoring pipeline with a small background, so exact explanations stay fast. */
    public static ChurnScoringService scoringService(ChurnProperties props, PredictionMonitor monitor, MeterRegistry meters) {
        props.getExplainer().setBackgroundSize(20);
        props.getExplainer().setPermutations(2);
        ModelRegistry registry = registry(props);
        ExplainService explainer = new ExplainService(registry,
                new BackgroundSampleProvider(props, new DefaultResourceLoader()),
                new PermutationShapAttributor(FeatureSchema.size(), props.getExplainer().getPermutations(),
                        props.getExplainer().getBackgroundSeed()),
                props, meters);
        return new ChurnScoringService(new CustomerValidator(), encoder(),
                new ChurnPredictor(registry, props, Clock.systemUTC()), explainer, monitor, meters);
    }
}
