package com.demo.churn.service.features.providers;

import com.demo.churn.model.Country;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.model.CustomerTier;
import com.demo.churn.model.Gender;
import com.demo.churn.service.features.FeatureProvider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.demo.churn.service.features.FeatureSchema.*;

/**
 * One-hot columns. FEMALE, FRANCE and RUBIS are the dropped reference levels,
 * so they encode as all zeros in their group.
 */
public class CategoricalFeaturesProvider implements FeatureProvider {
    private static final Set<String> COLS = Set.of(MALE, GERMANY, SPAIN, GOLD, PLATINUM, SILVER);

    @Override public Set<String> columns() { return COLS; }

    @Override
    public Map<String, Double> compute(CustomerRecord r) {
        Gender gender = Gender.fromLabel(r.getGender())
                .orElseThrow(() -> new IllegalArgumentException("unknown gender '" + r.getGender() + "'"));
        Country country = Country.fromLabel(r.getCountry())
                .orElseThrow(() -> new IllegalArgumentException("unknown country '" + r.getCountry() + "'"));
        CustomerTier tier = CustomerTier.fromLabel(r.getTier())
                .orElseThrow(() -> new IllegalArgumentException("unknown category '" + r.getTier() + "'"));

        Map<String, Double> f = new LinkedHashMap<>();
        f.put(MALE, gender == Gender.MALE ? 1.0 : 0.0);
        f.put(GERMANY, country == Country.GERMANY ? 1.0 : 0.0);
        f.put(SPAIN, country == Country.SPAIN ? 1.0 : 0.0);
        f.put(GOLD, tier == CustomerTier.GOLD ? 1.0 : 0.0);
        f.put(PLATINUM, tier == CustomerTier.PLATINUM ? 1.0 : 0.0);
        f.put(SILVER, tier == CustomerTier.SILVER ? 1.0 : 0.0);
        return f;
    }
}
