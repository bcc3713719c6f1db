package com.shieldmail.spamengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shieldmail.spamengine.domain.model.Feedback;
import com.shieldmail.spamengine.domain.model.ModelMetadata;
import com.shieldmail.spamengine.domain.model.PredictionRecord;

public record PredictionResponse(
        @JsonProperty("prediction_id") String predictionId,
        String text,
        @JsonProperty("is_spam") boolean spam,
        @JsonProperty("spam_probability") double spamProbability,
        @JsonProperty("safe_probability") double safeProbability,
        String timestamp,
        @JsonProperty("model_metadata") ModelMetadata modelMetadata,
        Feedback feedback
) {

    public static PredictionResponse from(PredictionRecord record, int previewLength) {
        return new PredictionResponse(
                record.getId(),
                preview(record.getText(), previewLength),
                record.isSpam(),
                record.getSpamProbability(),
                record.getSafeProbability(),
                record.getTimestamp().toString(),
                record.getModelMetadata(),
                record.getFeedback());
    }

    static String preview(String text, int previewLength) {
        if (text == null || text.codePointCount(0, text.length()) <= previewLength) return text;
        return text.substring(0, text.offsetByCodePoints(0, previewLength)) + "...";
    }
}
