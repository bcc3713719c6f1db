package com.shieldmail.spamengine.domain.repository;

import com.shieldmail.spamengine.domain.model.ClassificationResult;
import com.shieldmail.spamengine.domain.model.Feedback;
import com.shieldmail.spamengine.domain.model.ModelMetadata;
import com.shieldmail.spamengine.domain.model.PredictionRecord;
import com.shieldmail.spamengine.domain.model.PredictionStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PredictionStore {

    PredictionRecord create(String text, ClassificationResult result, ModelMetadata metadata);

    PredictionRecord create(String text, ClassificationResult result, ModelMetadata metadata, Instant timestamp);

    Optional<PredictionRecord> findById(String id);

    List<PredictionRecord> findAll(int limit, int offset);

    PredictionRecord updateFeedback(String id, Feedback feedback);

    void delete(String id);

    PredictionStats stats();

    long count();
}
