package com.demo.churn.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the scoring, explanation and monitoring engine.
 *
 * <p>Thresholds shipped as defaults are calibrated on accuracy and on the Population
 * Stability Index; changing {@code alerts.metric} usually means revisiting them.</p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "churn")
public class ChurnProperties {

    private Model model = new Model();
    private Risk risk = new Risk();
    private Explainer explainer = new Explainer();
    private Batch batch = new Batch();
    private Monitoring monitoring = new Monitoring();
    private Alerts alerts = new Alerts();

    @Data
    public static class Model {
        /** Spring resource location of the JSON model artifact. */
        private String path = "classpath:model/churn-model.json";
        /** Load the artifact while the context starts so a broken artifact aborts startup. */
        private boolean eagerLoad = true;
        private double decisionThreshold = 0.5;
    }

    @Data
    public static class Risk {
        /** Probabilities strictly below this are LOW. */
        private double lowUpper = 0.30;
        /** Probabilities strictly above this are HIGH. */
        private double highLower = 0.70;
    }

    @Data
    public static class Explainer {
        public enum Mode { AUTO, EXACT, APPROXIMATE }

        private Mode mode = Mode.AUTO;
        private int backgroundSize = 100;
        private long backgroundSeed = 42L;
        /** Optional CSV of already encoded rows; generated from reference marginals when empty. */
        private String backgroundPath = "";
        /** Number of antithetic permutation pairs per explanation. */
        private int permutations = 8;
        private int topK = 5;
        private double minorBelow = 0.02;
        private double majorAbove = 0.10;
    }

    @Data
    public static class Batch {
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private List<String> segmentKeys = new ArrayList<>(List.of("country", "tier"));
        private int maxRows = 50_000;
        /** Finished jobs kept for polling before the oldest are dropped. */
        private int retainedJobs = 50;
    }

    @Data
    public static class Monitoring {
        private Duration window = Duration.ofDays(30);
        private String snapshotCron = "0 0 0 * * *";
        private int maxHistory = 1_000;
        private int maxWindowSamples = 10_000;
        private int driftBins = 10;
        private int recentPredictions = 20_000;
        private long samplingSeed = 7L;
    }

    @Data
    public static class Alerts {
        public enum Metric { ACCURACY, PRECISION, RECALL, F1 }

        private Metric metric = Metric.ACCURACY;
        private double performanceCritical = 0.75;
        private double performanceAttention = 0.80;
        private double driftCritical = 0.25;
        private double driftAttention = 0.15;
        /** Windows with fewer predictions leave the drift state unchanged. */
        private long driftMinVolume = 30;
        private int highRiskCount = 10;
        /** Mean volume of the last 7 snapshots below which a volume alert opens; 0 disables it. */
        private double minVolume = 0;
    }
}
