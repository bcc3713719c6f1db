package com.shieldmail.spamengine.api;

import com.shieldmail.spamengine.api.dto.BatchPredictionResponse;
import com.shieldmail.spamengine.api.dto.ExplanationResponse;
import com.shieldmail.spamengine.api.dto.PredictionResponse;
import com.shieldmail.spamengine.domain.exception.InvalidRequestException;
import com.shieldmail.spamengine.domain.model.BatchClassification;
import com.shieldmail.spamengine.domain.model.Explanation;
import com.shieldmail.spamengine.domain.model.Feedback;
import com.shieldmail.spamengine.domain.model.PredictionRecord;
import com.shieldmail.spamengine.domain.service.PredictionService;
import com.shieldmail.spamengine.domain.service.SampleDataGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = {
        "http://localhost:3000", "http://localhost:5173",
        "http://127.0.0.1:3000", "http://127.0.0.1:5173"})
public class PredictionController {

    private final PredictionService predictionService;
    private final SampleDataGenerator sampleDataGenerator;
    private final ApiProperties apiProperties;

    @PostMapping("/predict")
    public ResponseEntity<PredictionResponse> predict(@RequestBody PredictRequest req) {
        checkLength(req.text());
        PredictionRecord record = predictionService.classify(req.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(record));
    }

    @PostMapping("/batch-predict")
    public ResponseEntity<BatchPredictionResponse> batchPredict(@RequestBody BatchPredictRequest req) {
        List<String> texts = req.texts();
        if (texts == null || texts.isEmpty()) {
            throw new InvalidRequestException("Texts list cannot be empty");
        }
        if (texts.size() > apiProperties.getMaxBatchSize()) {
            throw new InvalidRequestException("At most " + apiProperties.getMaxBatchSize() + " texts per batch");
        }
        texts.forEach(this::checkLength);

        BatchClassification batch = predictionService.classifyBatch(texts);
        return ResponseEntity.ok(new BatchPredictionResponse(
                batch.predictions().stream().map(this::toResponse).toList(),
                batch.totalProcessed(),
                batch.totalSpam(),
                batch.totalSafe()));
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<PredictionResponse>> list(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        List<PredictionResponse> items = predictionService.list(limit, Math.max(0, offset)).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(items);
    }

    @GetMapping("/predictions/{predictionId}")
    public ResponseEntity<PredictionResponse> get(@PathVariable String predictionId) {
        return ResponseEntity.ok(toResponse(predictionService.get(predictionId)));
    }

    @GetMapping("/predictions/{predictionId}/explanation")
    public ResponseEntity<ExplanationResponse> explain(@PathVariable String predictionId) {
        PredictionRecord record = predictionService.get(predictionId);
        Explanation explanation = predictionService.explain(record);
        return ResponseEntity.ok(new ExplanationResponse(
                record.getId(),
                record.isSpam(),
                record.getSpamProbability(),
                explanation.tokenImpacts(),
                explanation.heatmap()));
    }

    @PutMapping("/predictions/{predictionId}")
    public ResponseEntity<Map<String, Object>> updateFeedback(@PathVariable String predictionId,
                                                              @RequestBody FeedbackRequest req) {
        Feedback feedback;
        try {
            feedback = Feedback.fromCode(req.feedback());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
        if (feedback == null) {
            throw new InvalidRequestException("feedback is required: 'correct' or 'incorrect'");
        }

        predictionService.submitFeedback(predictionId, feedback);
        return ResponseEntity.ok(Map.of(
                "message", "Prediction feedback updated successfully",
                "prediction_id", predictionId,
                "feedback", feedback.code()));
    }

    @DeleteMapping("/predictions/{predictionId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String predictionId) {
        predictionService.delete(predictionId);
        return ResponseEntity.ok(Map.of(
                "message", "Prediction deleted successfully",
                "prediction_id", predictionId));
    }

    @PostMapping("/generate-sample-data")
    public ResponseEntity<Map<String, Object>> generateSampleData() {
        List<PredictionResponse> created = sampleDataGenerator.generate().stream()
                .map(this::toResponse)
                .toList();
        log.info("[Sample API] 샘플 데이터 생성 요청 처리: created={}", created.size());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "message", "Sample data generated successfully",
                "predictions_created", created.size(),
                "predictions", created));
    }

    private void checkLength(String text) {
        if (text != null && text.length() > apiProperties.getMaxTextLength()) {
            throw new InvalidRequestException(
                    "Text must be at most " + apiProperties.getMaxTextLength() + " characters");
        }
    }

    private PredictionResponse toResponse(PredictionRecord record) {
        return PredictionResponse.from(record, apiProperties.getPreviewLength());
    }

    public record PredictRequest(String text) {
    }

    public record BatchPredictRequest(List<String> texts) {
    }

    public record FeedbackRequest(String feedback) {
    }
}
