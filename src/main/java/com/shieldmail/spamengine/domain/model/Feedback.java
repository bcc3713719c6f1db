package com.shieldmail.spamengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Feedback {
    CORRECT,
    INCORRECT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Feedback fromCode(String code) {
        if (code == null) return null;
        for (Feedback f : values()) {
            if (f.code().equals(code.trim().toLowerCase(Locale.ROOT))) {
                return f;
            }
        }
        throw new IllegalArgumentException("feedback must be 'correct' or 'incorrect': " + code);
    }
}
