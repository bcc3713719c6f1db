package com.shieldmail.spamengine.domain.model;

import java.util.List;

public record BatchClassification(List<PredictionRecord> predictions, int totalSpam, int totalSafe) {

    public int totalProcessed() {
        return predictions.size();
    }
}
