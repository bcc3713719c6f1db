package com.shieldmail.spamengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StatsResponse(
        @JsonProperty("total_predictions") long totalPredictions,
        @JsonProperty("spam_count") long spamCount,
        @JsonProperty("safe_count") long safeCount,
        @JsonProperty("accuracy_feedback") double accuracyFeedback,
        @JsonProperty("recent_predictions") List<PredictionResponse> recentPredictions
) {
}
