package com.demo.churn.service.alert;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One raised condition. Entries are never removed; a cleared condition is kept with
 * {@code resolved} set.
 */
@Value
@Builder
@With
public class Alert {
    long id;
    AlertKind kind;
    AlertSeverity severity;
    String message;
    String recommendedAction;
    /** Value of the monitored quantity when the alert was raised. */
    double observedValue;
    double threshold;
    Instant raisedAt;
    Instant lastObservedAt;
    boolean resolved;
    Instant resolvedAt;
}
