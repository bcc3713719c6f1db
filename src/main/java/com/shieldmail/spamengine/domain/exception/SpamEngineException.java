package com.shieldmail.spamengine.domain.exception;

public abstract class SpamEngineException extends RuntimeException {

    protected SpamEngineException(String message) {
        super(message);
    }

    protected SpamEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
