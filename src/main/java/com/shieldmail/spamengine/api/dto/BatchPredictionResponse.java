package com.shieldmail.spamengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchPredictionResponse(
        List<PredictionResponse> predictions,
        @JsonProperty("total_processed") int totalProcessed,
        @JsonProperty("total_spam") int totalSpam,
        @JsonProperty("total_safe") int totalSafe
) {
}
