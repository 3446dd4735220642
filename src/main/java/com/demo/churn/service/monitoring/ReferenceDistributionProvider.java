package com.demo.churn.service.monitoring;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.service.explain.BackgroundSample;
import com.demo.churn.service.explain.BackgroundSampleProvider;
import com.demo.churn.service.model.ChurnClassifier;
import com.demo.churn.service.model.ModelRegistry;
import com.demo.churn.service.model.ModelReloadedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drift reference: the background sample rows and the active model's output on them.
 * Built on first use, rebuilt after a model reload.
 */
@Slf4j
@Component
public class ReferenceDistributionProvider {

    private final ModelRegistry models;
    private final BackgroundSampleProvider background;
    private final int bins;

    private final Object lock = new Object();
    private volatile ReferenceDistribution reference;

    public ReferenceDistributionProvider(ModelRegistry models, BackgroundSampleProvider background, ChurnProperties props) {
        this.models = models;
        this.background = background;
        this.bins = props.getMonitoring().getDriftBins();
    }

    /** Provider around a fixed reference. */
    public static ReferenceDistributionProvider fixed(ReferenceDistribution reference) {
        ReferenceDistributionProvider p = new ReferenceDistributionProvider(null, null, new ChurnProperties());
        p.reference = reference;
        return p;
    }

    public ReferenceDistribution get() {
        ReferenceDistribution r = reference;
        if (r != null) return r;
        synchronized (lock) {
            if (reference == null) {
                reference = build();
            }
            return reference;
        }
    }

    @EventListener
    public void onModelReloaded(ModelReloadedEvent event) {
        synchronized (lock) {
            reference = null;
        }
    }

    private ReferenceDistribution build() {
        if (models == null) throw new IllegalStateException("no model registry to build a reference from");
        ChurnClassifier model = models.get();
        BackgroundSample sample = background.get();
        double[][] rows = new double[sample.size()][];
        double[] probabilities = new double[sample.size()];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = sample.row(i);
            probabilities[i] = model.predictProba(rows[i]);
        }
        ReferenceDistribution r = ReferenceDistribution.of(sample.features(), rows, probabilities, bins);
        log.info("Drift reference built for model {} from {} rows ({} bins)", model.version(), r.size(), bins);
        return r;
    }
}
