package com.shieldmail.spamengine.domain.exception;

import lombok.Getter;

@Getter
public class PredictionNotFoundException extends SpamEngineException {

    private final String predictionId;

    public PredictionNotFoundException(String predictionId) {
        super("Prediction with ID " + predictionId + " not found");
        this.predictionId = predictionId;
    }
}
