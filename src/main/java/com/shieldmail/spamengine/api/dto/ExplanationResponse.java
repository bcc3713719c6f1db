package com.shieldmail.spamengine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shieldmail.spamengine.domain.model.HeatmapUnit;
import com.shieldmail.spamengine.domain.model.TokenImpact;

import java.util.List;

public record ExplanationResponse(
        @JsonProperty("prediction_id") String predictionId,
        @JsonProperty("is_spam") boolean spam,
        @JsonProperty("spam_probability") double spamProbability,
        @JsonProperty("token_impacts") List<TokenImpact> tokenImpacts,
        List<HeatmapUnit> heatmap
) {
}
