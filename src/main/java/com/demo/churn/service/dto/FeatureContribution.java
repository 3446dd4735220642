package com.demo.churn.service.dto;

import lombok.Builder;
import lombok.Value;

/** Signed share of one feature in the distance between the baseline and the prediction. */
@Value
@Builder(toBuilder = true)
public class FeatureContribution {

    public enum Direction { INCREASES, DECREASES, NEUTRAL }

    public enum Magnitude { MINOR, MODERATE, MAJOR }

    String feature;
    double value;
    double contribution;
    double absContribution;
    Direction direction;
    Magnitude magnitude;
    /** Short label; filled for the top factors only. */
    String title;
    /** Sentence for the summary; filled for the top factors only. */
    String text;
}
