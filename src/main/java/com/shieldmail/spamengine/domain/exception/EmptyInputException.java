package com.shieldmail.spamengine.domain.exception;

public class EmptyInputException extends SpamEngineException {

    public EmptyInputException() {
        super("Input text cannot be empty");
    }
}
