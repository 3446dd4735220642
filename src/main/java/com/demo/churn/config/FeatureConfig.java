package com.demo.churn.config;

import com.demo.churn.service.features.FeatureEncoder;
import com.demo.churn.service.features.providers.CategoricalFeaturesProvider;
import com.demo.churn.service.features.providers.FlagFeaturesProvider;
import com.demo.churn.service.features.providers.NumericFeaturesProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class FeatureConfig {

    @Bean
    public FeatureEncoder featureEncoder() {
        return new FeatureEncoder(List.of(
                new NumericFeaturesProvider(),
                new FlagFeaturesProvider(),
                new CategoricalFeaturesProvider()));
    }
}
