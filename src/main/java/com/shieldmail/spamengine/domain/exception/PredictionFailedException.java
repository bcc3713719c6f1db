package com.shieldmail.spamengine.domain.exception;

public class PredictionFailedException extends SpamEngineException {

    public PredictionFailedException(String message, Throwable cause) {
        super("Prediction failed: " + message, cause);
    }
}
