package com.shieldmail.spamengine.domain.exception;

public class InvalidRequestException extends SpamEngineException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
