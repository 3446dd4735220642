package com.demo.churn.service.features;

import com.demo.churn.model.CustomerRecord;

import java.util.Map;
import java.util.Set;

/** Computes one group of model columns from a validated record. */
public interface FeatureProvider {

    Set<String> columns();

    Map<String, Double> compute(CustomerRecord record);
}
