package com.demo.churn.service.features.providers;

import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.features.FeatureProvider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.demo.churn.service.features.FeatureSchema.*;

public class FlagFeaturesProvider implements FeatureProvider {
    private static final Set<String> COLS = Set.of(HAS_CARD, ACTIVE, COMPLAIN);

    @Override public Set<String> columns() { return COLS; }

    @Override
    public Map<String, Double> compute(CustomerRecord r) {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put(HAS_CARD, flag(r.getHasCreditCard()));
        f.put(ACTIVE, flag(r.getActiveMember()));
        f.put(COMPLAIN, flag(r.getHasComplaint()));
        return f;
    }

    private static double flag(Boolean b) {
        return b ? 1.0 : 0.0;
    }
}
