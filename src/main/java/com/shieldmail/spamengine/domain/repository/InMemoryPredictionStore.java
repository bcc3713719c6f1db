package com.shieldmail.spamengine.domain.repository;

import com.shieldmail.spamengine.domain.exception.PredictionNotFoundException;
import com.shieldmail.spamengine.domain.model.ClassificationResult;
import com.shieldmail.spamengine.domain.model.Feedback;
import com.shieldmail.spamengine.domain.model.ModelMetadata;
import com.shieldmail.spamengine.domain.model.PredictionRecord;
import com.shieldmail.spamengine.domain.model.PredictionStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryPredictionStore implements PredictionStore {

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry e) -> e.record().getTimestamp())
            .thenComparingLong(Entry::sequence)
            .reversed();

    private final StoreProperties properties;
    private final Clock clock;

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long nextSequence;

    @Override
    public PredictionRecord create(String text, ClassificationResult result, ModelMetadata metadata) {
        return create(text, result, metadata, Instant.now(clock));
    }

    @Override
    public PredictionRecord create(String text, ClassificationResult result, ModelMetadata metadata, Instant timestamp) {
        PredictionRecord record = PredictionRecord.builder()
                .id(UUID.randomUUID().toString())
                .text(text)
                .spam(result.isSpam())
                .spamProbability(result.getSpamProbability())
                .safeProbability(result.getSafeProbability())
                .timestamp(timestamp)
                .modelMetadata(metadata)
                .build();

        lock.writeLock().lock();
        try {
            entries.put(record.getId(), new Entry(nextSequence++, record));
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("[Store] 예측 저장: id={}, spam={}, spamProb={}", record.getId(), record.isSpam(),
                String.format("%.4f", record.getSpamProbability()));
        return record;
    }

    @Override
    public Optional<PredictionRecord> findById(String id) {
        if (id == null) return Optional.empty();
        lock.readLock().lock();
        try {
            Entry entry = entries.get(id);
            return entry == null ? Optional.empty() : Optional.of(entry.record());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PredictionRecord> findAll(int limit, int offset) {
        int safeLimit = limit <= 0 ? properties.getDefaultLimit() : Math.min(limit, properties.getMaxLimit());
        int safeOffset = Math.max(0, offset);

        lock.readLock().lock();
        try {
            return ordered().stream()
                    .skip(safeOffset)
                    .limit(safeLimit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public PredictionRecord updateFeedback(String id, Feedback feedback) {
        lock.writeLock().lock();
        try {
            Entry entry = id == null ? null : entries.get(id);
            if (entry == null) {
                throw new PredictionNotFoundException(id);
            }
            PredictionRecord updated = entry.record().withFeedback(feedback);
            entries.put(id, new Entry(entry.sequence(), updated));
            log.info("[Store] 피드백 갱신: id={}, feedback={}", id, feedback);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) {
        lock.writeLock().lock();
        try {
            if (id == null || entries.remove(id) == null) {
                throw new PredictionNotFoundException(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Store] 예측 삭제: id={}", id);
    }

    @Override
    public PredictionStats stats() {
        lock.readLock().lock();
        try {
            long total = entries.size();
            long spam = 0;
            long withFeedback = 0;
            long correct = 0;
            for (Entry e : entries.values()) {
                PredictionRecord r = e.record();
                if (r.isSpam()) spam++;
                if (r.hasFeedback()) {
                    withFeedback++;
                    if (r.getFeedback() == Feedback.CORRECT) correct++;
                }
            }

            double accuracy = withFeedback == 0
                    ? 0.0
                    : BigDecimal.valueOf(correct * 100.0 / withFeedback)
                            .setScale(2, RoundingMode.HALF_EVEN)
                            .doubleValue();

            List<PredictionRecord> recent = ordered().stream()
                    .limit(properties.getRecentCount())
                    .toList();

            return PredictionStats.builder()
                    .totalPredictions(total)
                    .spamCount(spam)
                    .safeCount(total - spam)
                    .accuracyFeedback(accuracy)
                    .recentPredictions(recent)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<PredictionRecord> ordered() {
        return entries.values().stream()
                .sorted(NEWEST_FIRST)
                .map(Entry::record)
                .toList();
    }

    private record Entry(long sequence, PredictionRecord record) {
    }
}
