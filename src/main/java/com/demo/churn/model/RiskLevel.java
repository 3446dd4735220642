package com.demo.churn.model;

/**
 * Discretized churn risk. Bucket boundaries live in configuration, see
 * {@link com.demo.churn.service.RiskLevelPolicy}.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
