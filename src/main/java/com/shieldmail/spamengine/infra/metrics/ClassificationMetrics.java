package com.shieldmail.spamengine.infra.metrics;

import com.shieldmail.spamengine.domain.model.Feedback;
import com.shieldmail.spamengine.domain.repository.PredictionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class ClassificationMetrics {

    private final MeterRegistry meterRegistry;
    private final PredictionStore predictionStore;

    @PostConstruct
    public void init() {
        Gauge.builder("spam.store.size", predictionStore, store -> (double) store.count())
                .description("Predictions currently held in the store")
                .register(meterRegistry);
        log.info("[Metrics] 분류 메트릭 등록 완료");
    }

    public void recordPrediction(boolean spam, long elapsedNanos) {
        Counter.builder("spam.predictions")
                .tag("label", spam ? "spam" : "safe")
                .description("Classified texts by predicted label")
                .register(meterRegistry)
                .increment();
        Timer.builder("spam.prediction.duration")
                .description("Classifier latency per text")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFailure(String reason) {
        Counter.builder("spam.prediction.failures")
                .tag("reason", reason)
                .description("Rejected or failed classifications")
                .register(meterRegistry)
                .increment();
    }

    public void recordFeedback(Feedback feedback) {
        Counter.builder("spam.feedback")
                .tag("feedback", feedback.code())
                .description("Feedback submitted on stored predictions")
                .register(meterRegistry)
                .increment();
    }
}
