package com.demo.churn.service.features;

import com.demo.churn.TestFixtures;
import com.demo.churn.common.Result;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.features.providers.CategoricalFeaturesProvider;
import com.demo.churn.service.features.providers.FlagFeaturesProvider;
import com.demo.churn.service.features.providers.NumericFeaturesProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureEncoderTest {

    private final FeatureEncoder encoder = new FeatureEncoder(List.of(
            new NumericFeaturesProvider(), new FlagFeaturesProvider(), new CategoricalFeaturesProvider()));

    @Test
    void encodesInModelColumnOrder() {
        Result<FeatureVector> r = encoder.encode(TestFixtures.validRecord().build());

        assertThat(r.isOk()).isTrue();
        assertThat(r.getData().getNames()).isEqualTo(FeatureSchema.MODEL_FEATURES);
        assertThat(r.getData().toArray()).containsExactly(
                620, 42, 3, 120_000, 2, 1, 0, 85_000, 1, 2, 450, 0, 1, 0, 1, 0, 0);
    }

    @Test
    void referenceLevelsEncodeAsZeros() {
        CustomerRecord rec = TestFixtures.validRecord().gender("Male").country("France").tier("RUBIS").build();

        FeatureVector v = encoder.encode(rec).getData();

        assertThat(v.get(FeatureSchema.MALE)).isEqualTo(1.0);
        assertThat(v.get(FeatureSchema.GERMANY)).isZero();
        assertThat(v.get(FeatureSchema.SPAIN)).isZero();
        assertThat(v.get(FeatureSchema.GOLD)).isZero();
        assertThat(v.get(FeatureSchema.PLATINUM)).isZero();
        assertThat(v.get(FeatureSchema.SILVER)).isZero();
    }

    @Test
    void sameRecordGivesSameVector() {
        CustomerRecord rec = TestFixtures.validRecord().build();

        assertThat(encoder.encode(rec).getData()).isEqualTo(encoder.encode(rec).getData());
    }

    @Test
    void providerFailureIsAnEncodingError() {
        CustomerRecord rec = TestFixtures.validRecord().age(null).build();

        Result<FeatureVector> r = encoder.encode(rec);

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo(FeatureEncoder.ENCODING_ERROR);
        assertThat(r.getError()).contains("NumericFeaturesProvider");
    }

    @Test
    void missingColumnIsAnEncodingError() {
        FeatureEncoder partial = new FeatureEncoder(List.of(new NumericFeaturesProvider(), new FlagFeaturesProvider()));

        Result<FeatureVector> r = partial.encode(TestFixtures.validRecord().build());

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getError()).contains(FeatureSchema.GERMANY);
    }

    @Test
    void duplicateColumnIsAnEncodingError() {
        FeatureProvider dup = new FeatureProvider() {
            @Override public Set<String> columns() { return Set.of(FeatureSchema.AGE); }
            @Override public Map<String, Double> compute(CustomerRecord record) { return Map.of(FeatureSchema.AGE, 1.0); }
        };
        FeatureEncoder broken = new FeatureEncoder(List.of(new NumericFeaturesProvider(), dup));

        assertThat(broken.encode(TestFixtures.validRecord().build()).getError()).contains("duplicate column");
    }

    @Test
    void providerWritingAnUndeclaredColumnIsAnEncodingError() {
        FeatureProvider sloppy = new FeatureProvider() {
            @Override public Set<String> columns() { return Set.of(FeatureSchema.MALE); }
            @Override public Map<String, Double> compute(CustomerRecord record) {
                return Map.of(FeatureSchema.MALE, 1.0, FeatureSchema.SPAIN, 0.0);
            }
        };
        FeatureEncoder broken = new FeatureEncoder(List.of(new NumericFeaturesProvider(), new FlagFeaturesProvider(), sloppy));

        Result<FeatureVector> r = broken.encode(TestFixtures.validRecord().build());

        assertThat(r.getErrorCode()).isEqualTo(FeatureEncoder.ENCODING_ERROR);
        assertThat(r.getError()).contains("undeclared or missing columns");
    }
}
