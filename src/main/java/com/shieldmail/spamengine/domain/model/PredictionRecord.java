package com.shieldmail.spamengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString(exclude = "text")
public class PredictionRecord {

    private final String id;
    private final String text;
    private final boolean spam;
    private final double spamProbability;
    private final double safeProbability;
    private final Instant timestamp;
    private final ModelMetadata modelMetadata;
    private final Feedback feedback;

    public PredictionRecord withFeedback(Feedback newFeedback) {
        return toBuilder().feedback(newFeedback).build();
    }

    public boolean hasFeedback() {
        return feedback != null;
    }
}
