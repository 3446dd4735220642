package com.demo.churn.service.features.providers;

import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.features.FeatureProvider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.demo.churn.service.features.FeatureSchema.*;

/** Raw numeric attributes, passed through unscaled (scaling belongs to the model artifact). */
public class NumericFeaturesProvider implements FeatureProvider {
    private static final Set<String> COLS = Set.of(CREDIT_SCORE, AGE, TENURE, BALANCE, PRODUCTS, SALARY, SATISFACTION, POINTS);

    @Override public Set<String> columns() { return COLS; }

    @Override
    public Map<String, Double> compute(CustomerRecord r) {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put(CREDIT_SCORE, r.getCreditScore().doubleValue());
        f.put(AGE, r.getAge().doubleValue());
        f.put(TENURE, r.getTenure().doubleValue());
        f.put(BALANCE, r.getBalance());
        f.put(PRODUCTS, r.getProductCount().doubleValue());
        f.put(SALARY, r.getEstimatedSalary());
        f.put(SATISFACTION, r.getSatisfactionScore().doubleValue());
        f.put(POINTS, r.getLoyaltyPoints().doubleValue());
        return f;
    }
}
