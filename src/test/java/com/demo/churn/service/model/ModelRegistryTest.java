package com.demo.churn.service.model;

import com.demo.churn.TestFixtures;
import com.demo.churn.config.ChurnProperties;
import com.demo.churn.exception.ModelLoadException;
import com.demo.churn.service.features.FeatureSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<Object> events = new ArrayList<>();

    @TempDir
    Path dir;

    private ModelRegistry registry(String location) {
        ChurnProperties props = TestFixtures.props();
        props.getModel().setPath(location);
        return new ModelRegistry(new DefaultResourceLoader(), mapper, props, events::add);
    }

    @Test
    void loadsTheShippedArtifactLazily() {
        ModelRegistry r = registry("classpath:model/churn-model.json");
        assertThat(r.isLoaded()).isFalse();

        ChurnClassifier c = r.get();

        assertThat(r.isLoaded()).isTrue();
        assertThat(c.type()).isEqualTo("logistic");
        assertThat(c.version()).isEqualTo("churn-logit-2024.1");
        assertThat(c.features()).isEqualTo(FeatureSchema.MODEL_FEATURES);
        assertThat(r.get()).isSameAs(c);
        assertThat(r.generation()).isEqualTo(1);
    }

    @Test
    void missingArtifactIsAModelLoadError() {
        ModelRegistry r = registry("classpath:model/no-such-model.json");

        assertThatThrownBy(r::get)
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void unreadableArtifactIsAModelLoadError() throws IOException {
        Path file = Files.writeString(dir.resolve("broken.json"), "{ not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> registry(file.toUri().toString()).get()).isInstanceOf(ModelLoadException.class);
    }

    @Test
    void schemaMismatchIsRejected() throws IOException {
        String json = "{\"model_version\":\"x\",\"model_type\":\"logistic\",\"features\":[\"age\",\"tenure\"],"
                + "\"logistic\":{\"intercept\":0.0,\"coefficients\":[0.1,0.2]}}";
        Path file = Files.writeString(dir.resolve("two.json"), json, StandardCharsets.UTF_8);

        assertThatThrownBy(() -> registry(file.toUri().toString()).get())
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void unsupportedModelTypeIsRejected() throws IOException {
        Path file = Files.writeString(dir.resolve("svm.json"),
                "{\"model_type\":\"svm\",\"features\":[\"age\"]}", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> registry(file.toUri().toString()).get())
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("unsupported model_type");
    }

    @Test
    void reloadSwapsAndPublishes() {
        ModelRegistry r = registry("classpath:model/churn-model.json");
        ChurnClassifier first = r.get();

        ChurnClassifier second = r.reload();

        assertThat(second).isNotSameAs(first);
        assertThat(r.get()).isSameAs(second);
        assertThat(r.generation()).isEqualTo(2);
        assertThat(events).singleElement().isEqualTo(
                new ModelReloadedEvent("churn-logit-2024.1", "churn-logit-2024.1", 2));
    }

    @Test
    void failedReloadKeepsThePreviousModel() {
        ChurnProperties props = TestFixtures.props();
        props.getModel().setPath("classpath:model/churn-model.json");
        ModelRegistry r = new ModelRegistry(new DefaultResourceLoader(), mapper, props, events::add);
        ChurnClassifier first = r.get();
        props.getModel().setPath("classpath:model/no-such-model.json");

        assertThatThrownBy(r::reload).isInstanceOf(ModelLoadException.class);
        assertThat(r.get()).isSameAs(first);
        assertThat(events).isEmpty();
    }

    @Test
    void preloadedRegistryServesTheGivenModel() {
        ChurnClassifier model = TestFixtures.logisticModel();

        ModelRegistry r = ModelRegistry.preloaded(model, TestFixtures.props());

        assertThat(r.get()).isSameAs(model);
        assertThat(r.isLoaded()).isTrue();
    }
}
