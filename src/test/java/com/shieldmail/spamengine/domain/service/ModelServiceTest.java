package com.shieldmail.spamengine.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldmail.spamengine.domain.exception.EmptyInputException;
import com.shieldmail.spamengine.domain.exception.ModelNotLoadedException;
import com.shieldmail.spamengine.domain.exception.PredictionFailedException;
import com.shieldmail.spamengine.domain.model.ClassificationResult;
import com.shieldmail.spamengine.domain.model.ModelMetadata;
import com.shieldmail.spamengine.domain.service.classifier.ClassifierPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModelServiceTest {

    private static ModelService service(String artifact, String metadata) {
        ModelProperties properties = new ModelProperties();
        properties.setArtifactLocation(artifact);
        properties.setMetadataLocation(metadata);
        ModelService service = new ModelService(properties, new DefaultResourceLoader(), new ObjectMapper());
        service.load();
        return service;
    }

    private static ModelService loadedService() {
        return service("classpath:fixtures/tiny-model.json", "classpath:fixtures/tiny-metadata.json");
    }

    @Test
    void classifiesObviousSpam() {
        ModelService service = loadedService();

        ClassificationResult result = service.predict(
                "WINNER!! You have been selected for a $1000 prize! Click here now: http://spam-link.com");

        assertThat(service.isLoaded()).isTrue();
        assertThat(result.isSpam()).isTrue();
        assertThat(result.getSpamProbability()).isGreaterThan(0.5);
        assertThat(result.getSpamProbability() + result.getSafeProbability()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void classifiesFollowUpAsLegitimate() {
        ModelService service = loadedService();

        ClassificationResult result = service.predict("Hi, I wanted to follow up on our meeting yesterday.");

        assertThat(result.isSpam()).isFalse();
        assertThat(result.getSafeProbability()).isGreaterThan(result.getSpamProbability());
    }

    @Test
    void labelAgreesWithProbabilitiesOnTies() {
        ModelService service = loadedService();

        ClassificationResult result = service.predict("nothing the model knows about");

        assertThat(result.getSpamProbability()).isCloseTo(0.5, within(1e-12));
        assertThat(result.isSpam()).isEqualTo(result.getSpamProbability() > result.getSafeProbability());
    }

    @Test
    void missingArtifactLeavesServiceUnloaded() {
        ModelService service = service("classpath:fixtures/does-not-exist.json", "classpath:fixtures/tiny-metadata.json");

        assertThat(service.isLoaded()).isFalse();
        assertThat(service.getMetadata()).isNull();
        assertThat(service.getModelInfo()).containsEntry("is_loaded", false);
        assertThatThrownBy(() -> service.predict("hello"))
                .isInstanceOf(ModelNotLoadedException.class);
    }

    @Test
    void malformedArtifactDoesNotThrowDuringLoad() {
        ModelService service = service("classpath:fixtures/mismatched-model.json", "classpath:fixtures/tiny-metadata.json");

        assertThat(service.isLoaded()).isFalse();
    }

    @Test
    void notLoadedIsReportedBeforeEmptyInput() {
        ModelService service = service("classpath:fixtures/does-not-exist.json", "classpath:fixtures/tiny-metadata.json");

        assertThatThrownBy(() -> service.predict("   "))
                .isInstanceOf(ModelNotLoadedException.class);
    }

    @Test
    void rejectsBlankText() {
        ModelService service = loadedService();

        assertThatThrownBy(() -> service.predict(" \n\t "))
                .isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> service.predict(null))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void unicodeSpacesCountAsBlank() {
        ModelService service = loadedService();

        assertThatThrownBy(() -> service.predict("\u00A0\u2007\u202F\u3000"))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void tieIsSafeWhateverTheSpamClassIndex() {
        ModelProperties properties = new ModelProperties();
        properties.setSpamClass(0);
        ModelService service = new ModelService(properties, new DefaultResourceLoader(), new ObjectMapper());
        ClassifierPipeline even = mock(ClassifierPipeline.class);
        when(even.classes()).thenReturn(new int[]{0, 1});
        when(even.predictProba(anyString())).thenReturn(new double[]{0.5, 0.5}, new double[]{0.7, 0.3});
        service.install(even, ModelMetadata.unknown(), "mock");

        ClassificationResult tie = service.predict("anything");
        ClassificationResult spam = service.predict("anything else");

        assertThat(tie.isSpam()).isFalse();
        assertThat(tie.getSpamProbability()).isEqualTo(tie.getSafeProbability());
        assertThat(spam.isSpam()).isTrue();
        assertThat(spam.getSpamProbability()).isEqualTo(0.7);
    }

    @Test
    void wrapsClassifierErrors() {
        ModelService service = loadedService();
        ClassifierPipeline failing = mock(ClassifierPipeline.class);
        when(failing.classes()).thenReturn(new int[]{0, 1});
        when(failing.predictProba(anyString())).thenThrow(new IllegalArgumentException("vocabulary corrupted"));
        service.install(failing, ModelMetadata.unknown(), "mock");

        assertThatThrownBy(() -> service.predict("any text"))
                .isInstanceOf(PredictionFailedException.class)
                .hasMessageContaining("vocabulary corrupted")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(service.isLoaded()).isTrue();
    }

    @Test
    void metadataIsSnapshotWithSource() {
        ModelService service = loadedService();

        ModelMetadata metadata = service.getMetadata();

        assertThat(metadata.getModelType()).isEqualTo("MultinomialNB");
        assertThat(metadata.getAccuracy()).isEqualTo(0.95);
        assertThat(metadata.getF1Score()).isEqualTo(0.874);
        assertThat(metadata.getNFeatures()).isEqualTo(4);
        assertThat(metadata.getSource()).isEqualTo(ModelService.METADATA_SOURCE);
        assertThat(service.getMetadata()).isNotSameAs(metadata).isEqualTo(metadata);
    }

    @Test
    void missingMetadataFallsBackToUnknown() {
        ModelService service = service("classpath:fixtures/tiny-model.json", "classpath:fixtures/none.json");

        assertThat(service.isLoaded()).isTrue();
        assertThat(service.getMetadata().getModelType()).isEqualTo("Unknown");
        assertThat(service.getMetadata().getAccuracy()).isZero();
    }

    @Test
    void modelInfoDescribesLoadedArtifact() {
        Map<String, Object> info = loadedService().getModelInfo();

        assertThat(info)
                .containsEntry("is_loaded", true)
                .containsEntry("model_path", "classpath:fixtures/tiny-model.json")
                .containsKey("metadata");
    }
}
