package com.demo.churn.service.alert;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AlertKind {
    PERFORMANCE_DEGRADATION("Re-evaluate the model on recent labelled data and consider retraining"),
    DATA_DRIFT("Investigate the input distribution changes and watch the drifting variables"),
    HIGH_RISK_CUSTOMER("Contact the high-risk customers with a retention offer"),
    PREDICTION_VOLUME("Check that upstream systems are still sending customers to score");

    private final String recommendedAction;
}
