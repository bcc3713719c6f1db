package com.shieldmail.spamengine.domain.exception;

public class ModelNotLoadedException extends SpamEngineException {

    public ModelNotLoadedException() {
        super("Model is not loaded. Package the classifier artifact under the configured model location.");
    }
}
