package com.demo.churn.config;

import com.demo.churn.service.explain.BackgroundSampleProvider;
import com.demo.churn.service.explain.FeatureAttributor;
import com.demo.churn.service.explain.GlobalImportanceAttributor;
import com.demo.churn.service.explain.PermutationShapAttributor;
import com.demo.churn.service.features.FeatureSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the attribution capability once, at startup. In AUTO mode exact attribution is used
 * when a background sample can be built.
 */
@Slf4j
@Configuration
public class ExplainerConfig {

    @Bean
    public FeatureAttributor featureAttributor(ChurnProperties props, BackgroundSampleProvider background) {
        ChurnProperties.Explainer cfg = props.getExplainer();
        switch (cfg.getMode()) {
            case APPROXIMATE:
                log.info("Explainer forced to approximate attribution");
                return new GlobalImportanceAttributor();
            case EXACT:
                return exact(cfg);
            default:
                try {
                    background.get();
                    return exact(cfg);
                } catch (RuntimeException e) {
                    log.warn("No background sample available ({}), explanations will be approximate", e.getMessage());
                    return new GlobalImportanceAttributor();
                }
        }
    }

    private static FeatureAttributor exact(ChurnProperties.Explainer cfg) {
        return new PermutationShapAttributor(FeatureSchema.size(), cfg.getPermutations(), cfg.getBackgroundSeed());
    }
}
