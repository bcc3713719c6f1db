package com.shieldmail.spamengine.domain.service;

import com.shieldmail.spamengine.domain.exception.EmptyInputException;
import com.shieldmail.spamengine.domain.exception.ModelNotLoadedException;
import com.shieldmail.spamengine.domain.exception.PredictionNotFoundException;
import com.shieldmail.spamengine.domain.exception.SpamEngineException;
import com.shieldmail.spamengine.domain.model.BatchClassification;
import com.shieldmail.spamengine.domain.model.ClassificationResult;
import com.shieldmail.spamengine.domain.model.Explanation;
import com.shieldmail.spamengine.domain.model.Feedback;
import com.shieldmail.spamengine.domain.model.PredictionRecord;
import com.shieldmail.spamengine.domain.model.PredictionStats;
import com.shieldmail.spamengine.domain.repository.PredictionStore;
import com.shieldmail.spamengine.domain.service.explain.ExplanationProvider;
import com.shieldmail.spamengine.infra.metrics.ClassificationMetrics;
import com.shieldmail.spamengine.infra.websocket.PredictionBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    private final ModelService modelService;
    private final PredictionStore predictionStore;
    private final ExplanationProvider explanationProvider;
    private final ClassificationMetrics metrics;
    private final PredictionBroadcaster broadcaster;

    public PredictionRecord classify(String text) {
        String input = InputText.strip(text);
        long startNano = System.nanoTime();

        ClassificationResult result;
        try {
            result = modelService.predict(input);
        } catch (SpamEngineException e) {
            metrics.recordFailure(failureReason(e));
            throw e;
        }

        PredictionRecord record = predictionStore.create(input, result, modelService.getMetadata());
        long elapsed = System.nanoTime() - startNano;
        metrics.recordPrediction(record.isSpam(), elapsed);
        broadcaster.broadcastCreated(record);

        log.info("[Predict] 분류 완료: id={}, spam={}, spamProb={}, length={}, took={}μs",
                record.getId(), record.isSpam(), String.format("%.4f", record.getSpamProbability()),
                input.length(), elapsed / 1_000);
        return record;
    }

    public BatchClassification classifyBatch(List<String> texts) {
        List<PredictionRecord> records = new ArrayList<>(texts.size());
        int spam = 0;
        for (String text : texts) {
            if (InputText.isBlank(text)) continue;
            PredictionRecord record = classify(text);
            records.add(record);
            if (record.isSpam()) spam++;
        }
        log.info("[Predict] 배치 분류 완료: requested={}, processed={}, spam={}",
                texts.size(), records.size(), spam);
        return new BatchClassification(List.copyOf(records), spam, records.size() - spam);
    }

    public PredictionRecord get(String id) {
        return predictionStore.findById(id)
                .orElseThrow(() -> new PredictionNotFoundException(id));
    }

    public List<PredictionRecord> list(int limit, int offset) {
        return predictionStore.findAll(limit, offset);
    }

    public PredictionRecord submitFeedback(String id, Feedback feedback) {
        PredictionRecord updated = predictionStore.updateFeedback(id, feedback);
        metrics.recordFeedback(feedback);
        return updated;
    }

    public void delete(String id) {
        predictionStore.delete(id);
        broadcaster.broadcastDeleted(id);
    }

    public PredictionStats stats() {
        return predictionStore.stats();
    }

    public Explanation explain(String id) {
        return explain(get(id));
    }

    public Explanation explain(PredictionRecord record) {
        Explanation explanation = explanationProvider.explain(
                record.getText(), record.isSpam(), record.getSpamProbability());
        log.debug("[Explain] id={}, tokens={}, units={}",
                record.getId(), explanation.tokenImpacts().size(), explanation.heatmap().size());
        return explanation;
    }

    private static String failureReason(SpamEngineException e) {
        if (e instanceof ModelNotLoadedException) return "not_loaded";
        if (e instanceof EmptyInputException) return "empty_input";
        return "failed";
    }
}
