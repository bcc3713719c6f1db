package com.shieldmail.spamengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class PredictionStats {

    private final long totalPredictions;
    private final long spamCount;
    private final long safeCount;

    private final double accuracyFeedback;

    private final List<PredictionRecord> recentPredictions;
}
