package com.shieldmail.spamengine.domain.service;

import com.shieldmail.spamengine.domain.exception.ModelNotLoadedException;
import com.shieldmail.spamengine.domain.model.ClassificationResult;
import com.shieldmail.spamengine.domain.model.PredictionRecord;
import com.shieldmail.spamengine.domain.repository.PredictionStore;
import com.shieldmail.spamengine.infra.websocket.PredictionBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SampleDataGenerator {

    static final List<Sample> SAMPLES = List.of(
            new Sample("Hello, I hope this email finds you well. I wanted to follow up on our previous "
                    + "discussion about the project timeline. Please let me know if you have any questions.",
                    Month.OCTOBER, 31, 10, 0, false, 0.15),
            new Sample("WINNER! You have been selected to receive a FREE prize! Click now to claim your "
                    + "$1000 cash reward! Limited time offer!",
                    Month.NOVEMBER, 2, 14, 30, true, 0.65),
            new Sample("URGENT! Act now! Get rich quick! Make money fast! No investment required! "
                    + "Click here for instant cash!",
                    Month.NOVEMBER, 3, 9, 15, true, 0.70),
            new Sample("Thank you for your email. I appreciate your time and consideration. I will review "
                    + "the documents and get back to you by the end of the week.",
                    Month.NOVEMBER, 5, 16, 45, false, 0.20),
            new Sample("Congratulations! You won $5000! Claim your prize now! Free money! No strings "
                    + "attached! Click here immediately!",
                    Month.NOVEMBER, 6, 11, 20, true, 0.75));

    private final ModelService modelService;
    private final PredictionStore predictionStore;
    private final PredictionBroadcaster broadcaster;
    private final Clock clock;

    public List<PredictionRecord> generate() {
        if (!modelService.isLoaded()) {
            throw new ModelNotLoadedException();
        }

        int year = LocalDateTime.now(clock).getYear();
        List<PredictionRecord> created = new ArrayList<>(SAMPLES.size());

        for (Sample sample : SAMPLES) {
            modelService.predict(sample.text());

            ClassificationResult result = ClassificationResult.builder()
                    .spam(sample.spam())
                    .spamProbability(sample.spamProbability())
                    .safeProbability(1.0 - sample.spamProbability())
                    .build();
            LocalDateTime at = LocalDateTime.of(year, sample.month(), sample.day(), sample.hour(), sample.minute());

            PredictionRecord record = predictionStore.create(
                    sample.text(), result, modelService.getMetadata(), at.atZone(clock.getZone()).toInstant());
            broadcaster.broadcastCreated(record);
            created.add(record);
        }

        log.info("[Sample] 샘플 예측 {}건 생성", created.size());
        return List.copyOf(created);
    }

    record Sample(String text, Month month, int day, int hour, int minute, boolean spam, double spamProbability) {
    }
}
