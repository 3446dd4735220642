package com.demo.churn.service.model;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.exception.ModelLoadException;
import com.demo.churn.service.features.FeatureSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Holds the process-wide classifier. Loaded lazily on first use (or while the context
 * starts when {@code churn.model.eager-load} is set) and never reloaded implicitly:
 * a model swap goes through {@link #reload()}.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ChurnProperties props;
    private final ApplicationEventPublisher events;

    private final Object lock = new Object();
    private volatile ChurnClassifier current;
    private volatile long generation;

    public ModelRegistry(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                         ChurnProperties props, ApplicationEventPublisher events) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.props = props;
        this.events = events;
    }

    /** Registry around an already built classifier, for embedding without an artifact file. */
    public static ModelRegistry preloaded(ChurnClassifier classifier, ChurnProperties props) {
        ModelRegistry r = new ModelRegistry(null, null, props, event -> { });
        r.current = checkSchema(classifier);
        r.generation = 1;
        return r;
    }

    @PostConstruct
    void warmUp() {
        if (props.getModel().isEagerLoad()) {
            ChurnClassifier c = get();
            log.info("Model ready at startup: version={} type={}", c.version(), c.type());
        }
    }

    /**
     * The active classifier. The first call loads it; a load failure is thrown as
     * {@link ModelLoadException} and is not retried automatically.
     */
    public ChurnClassifier get() {
        ChurnClassifier c = current;
        if (c != null) return c;
        synchronized (lock) {
            if (current == null) {
                current = load(props.getModel().getPath());
                generation++;
            }
            return current;
        }
    }

    /**
     * Loads the artifact again and swaps it in. On failure the previous model stays active.
     */
    public ChurnClassifier reload() {
        ChurnClassifier fresh = load(props.getModel().getPath());
        ModelReloadedEvent event;
        synchronized (lock) {
            String previous = current == null ? null : current.version();
            current = fresh;
            generation++;
            event = new ModelReloadedEvent(previous, fresh.version(), generation);
        }
        log.info("Model reloaded: {} -> {} (generation {})", event.previousVersion(), event.currentVersion(), event.generation());
        events.publishEvent(event);
        return fresh;
    }

    public long generation() {
        return generation;
    }

    public boolean isLoaded() {
        return current != null;
    }

    ChurnClassifier load(String location) {
        if (resourceLoader == null) {
            throw new ModelLoadException("No artifact location available for a preloaded registry");
        }
        log.info("Loading churn model from {}", location);
        Resource resource = resourceLoader.getResource(location);
        ModelArtifact artifact;
        try (InputStream in = resource.getInputStream()) {
            artifact = objectMapper.readValue(in, ModelArtifact.class);
        } catch (FileNotFoundException e) {
            log.error("Model artifact not found: {}", location);
            throw new ModelLoadException("Model artifact not found: " + location, e);
        } catch (IOException e) {
            log.error("Cannot read model artifact {}: {}", location, e.toString());
            throw new ModelLoadException("Cannot read model artifact " + location + ": " + e.getMessage(), e);
        }
        try {
            ChurnClassifier c = checkSchema(fromArtifact(artifact));
            log.info("Model loaded: version={} type={} features={}", c.version(), c.type(), c.features().size());
            return c;
        } catch (IllegalArgumentException e) {
            log.error("Invalid model artifact {}: {}", location, e.getMessage());
            throw new ModelLoadException("Invalid model artifact " + location + ": " + e.getMessage(), e);
        }
    }

    static ChurnClassifier fromArtifact(ModelArtifact a) {
        if (a.getFeatures() == null || a.getFeatures().isEmpty()) {
            throw new IllegalArgumentException("artifact declares no features");
        }
        String type = a.getModelType() == null ? "" : a.getModelType().toLowerCase(Locale.ROOT);
        String version = a.getModelVersion() == null ? "unversioned" : a.getModelVersion();
        double[] importances = toArray(a.getFeatureImportances());
        switch (type) {
            case "logistic": {
                ModelArtifact.Logistic l = a.getLogistic();
                if (l == null || l.getCoefficients() == null) {
                    throw new IllegalArgumentException("logistic block with coefficients is required");
                }
                return new LogisticChurnClassifier(version, a.getFeatures(), l.getIntercept(),
                        toArray(l.getCoefficients()), toArray(l.getMeans()), toArray(l.getScales()), importances);
            }
            case "tree_ensemble":
                return new TreeEnsembleChurnClassifier(version, a.getFeatures(), a.getTrees(), importances);
            default:
                throw new IllegalArgumentException("unsupported model_type '" + a.getModelType() + "'");
        }
    }

    private static ChurnClassifier checkSchema(ChurnClassifier c) {
        List<String> expected = FeatureSchema.MODEL_FEATURES;
        if (!expected.equals(c.features())) {
            throw new ModelLoadException("Model feature order " + c.features()
                    + " does not match the encoder schema " + expected);
        }
        return c;
    }

    private static double[] toArray(List<Double> list) {
        if (list == null) return null;
        double[] d = new double[list.size()];
        for (int i = 0; i < d.length; i++) d[i] = list.get(i);
        return d;
    }
}
