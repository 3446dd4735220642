package com.demo.churn.service.explain;

/**
 * Attribution capability. Two implementations exist, an exact one and a degraded one;
 * which one is active is decided once at startup.
 */
public interface FeatureAttributor {

    String method();

    boolean isExact();

    Attribution attribute(AttributionContext ctx, double[] x);
}
