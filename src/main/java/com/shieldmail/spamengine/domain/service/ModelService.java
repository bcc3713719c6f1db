package com.shieldmail.spamengine.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldmail.spamengine.domain.exception.EmptyInputException;
import com.shieldmail.spamengine.domain.exception.ModelNotLoadedException;
import com.shieldmail.spamengine.domain.exception.PredictionFailedException;
import com.shieldmail.spamengine.domain.model.ClassificationResult;
import com.shieldmail.spamengine.domain.model.ModelMetadata;
import com.shieldmail.spamengine.domain.service.classifier.ClassifierPipeline;
import com.shieldmail.spamengine.domain.service.classifier.PipelineArtifact;
import com.shieldmail.spamengine.domain.service.classifier.TfidfNaiveBayesPipeline;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelService {

    static final String METADATA_SOURCE = "packaged-artifact";

    private final ModelProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private volatile LoadedModel loaded;

    @PostConstruct
    public void load() {
        Resource resource = resourceLoader.getResource(properties.getArtifactLocation());
        if (!resource.exists()) {
            log.warn("[Model] 분류기 아티팩트 없음: location={}. 모델 미로딩 상태로 시작합니다.",
                    properties.getArtifactLocation());
            return;
        }

        try {
            PipelineArtifact artifact;
            try (InputStream in = resource.getInputStream()) {
                artifact = objectMapper.readValue(in, PipelineArtifact.class);
            }
            TfidfNaiveBayesPipeline pipeline = TfidfNaiveBayesPipeline.fromArtifact(artifact);
            ModelMetadata metadata = readMetadata();
            install(pipeline, metadata, properties.getArtifactLocation());

            log.info("[Model] 분류기 로딩 완료: location={}, type={}, variant={}, features={}",
                    properties.getArtifactLocation(), metadata.getModelType(),
                    pipeline.variant(), pipeline.featureCount());
        } catch (IOException | RuntimeException e) {
            log.error("[Model] 분류기 로딩 실패: location={}", properties.getArtifactLocation(), e);
            loaded = null;
        }
    }

    void install(ClassifierPipeline pipeline, ModelMetadata metadata, String location) {
        int spamIndex = indexOf(pipeline.classes(), properties.getSpamClass());
        if (pipeline.classes().length != 2 || spamIndex < 0) {
            throw new IllegalStateException("expected a two-class pipeline containing spam class "
                    + properties.getSpamClass());
        }
        loaded = new LoadedModel(pipeline, spamIndex, metadata, location);
    }

    public boolean isLoaded() {
        return loaded != null;
    }

    public ClassificationResult predict(String text) {
        LoadedModel model = loaded;
        if (model == null) {
            throw new ModelNotLoadedException();
        }
        if (InputText.isBlank(text)) {
            throw new EmptyInputException();
        }

        double[] proba;
        try {
            proba = model.pipeline().predictProba(text);
            if (proba.length != 2) {
                throw new IllegalStateException("expected 2 class probabilities, got " + proba.length);
            }
        } catch (RuntimeException e) {
            log.warn("[Model] 예측 실패: length={}, cause={}", text.length(), e.toString());
            throw new PredictionFailedException(String.valueOf(e.getMessage()), e);
        }

        int spamIndex = model.spamIndex();
        return ClassificationResult.builder()
                .spam(proba[spamIndex] > proba[1 - spamIndex])
                .spamProbability(proba[spamIndex])
                .safeProbability(proba[1 - spamIndex])
                .build();
    }

    public ModelMetadata getMetadata() {
        LoadedModel model = loaded;
        if (model == null) return null;
        return model.metadata().toBuilder()
                .source(METADATA_SOURCE)
                .build();
    }

    public Map<String, Object> getModelInfo() {
        LoadedModel model = loaded;
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("is_loaded", model != null);
        info.put("model_path", model != null ? model.location() : null);
        info.put("metadata", getMetadata());
        return info;
    }

    private ModelMetadata readMetadata() throws IOException {
        Resource resource = resourceLoader.getResource(properties.getMetadataLocation());
        if (!resource.exists()) {
            log.info("[Model] 메타데이터 파일 없음, 기본값 사용: location={}", properties.getMetadataLocation());
            return ModelMetadata.unknown();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, ModelMetadata.class);
        }
    }

    private static int indexOf(int[] classes, int label) {
        for (int i = 0; i < classes.length; i++) {
            if (classes[i] == label) return i;
        }
        return -1;
    }

    private record LoadedModel(ClassifierPipeline pipeline, int spamIndex, ModelMetadata metadata, String location) {
    }
}
