package com.demo.churn.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/** On-disk form of the fitted classifier, read with Jackson. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifact {

    @JsonProperty("model_version")
    private String modelVersion;

    /** {@code logistic} or {@code tree_ensemble}. */
    @JsonProperty("model_type")
    private String modelType;

    private List<String> features;

    @JsonProperty("feature_importances")
    private List<Double> featureImportances;

    private Logistic logistic;

    private List<Tree> trees;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Logistic {
        private double intercept;
        private List<Double> coefficients;
        /** Optional centering, one per feature. */
        private List<Double> means;
        /** Optional scaling, one per feature; zero entries are treated as 1. */
        private List<Double> scales;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Tree {
        /** Node 0 is the root. */
        private List<Node> nodes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Node {
        /** Split column index, -1 for a leaf. */
        private int feature = -1;
        private double threshold;
        private int left = -1;
        private int right = -1;
        /** Churn probability at a leaf. */
        private double value;
    }
}
