package com.shieldmail.spamengine.infra.websocket;

import com.shieldmail.spamengine.domain.model.PredictionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class PredictionBroadcaster {

    static final String DESTINATION = "/topic/predictions";

    private final SimpMessagingTemplate messagingTemplate;

    public void broadcastCreated(PredictionRecord record) {
        send("created", record);
    }

    public void broadcastDeleted(String predictionId) {
        try {
            messagingTemplate.convertAndSend(DESTINATION, Map.of(
                    "event", "deleted",
                    "prediction_id", predictionId));
        } catch (MessagingException e) {
            log.warn("[Broadcast] 삭제 이벤트 전송 실패: id={}", predictionId, e);
        }
    }

    private void send(String event, PredictionRecord record) {
        try {
            messagingTemplate.convertAndSend(DESTINATION, Map.of(
                    "event", event,
                    "prediction_id", record.getId(),
                    "is_spam", record.isSpam(),
                    "spam_probability", record.getSpamProbability(),
                    "timestamp", record.getTimestamp().toString()));
            log.debug("[Broadcast] {} → {}, id={}", event, DESTINATION, record.getId());
        } catch (MessagingException e) {
            log.warn("[Broadcast] 예측 이벤트 전송 실패: id={}", record.getId(), e);
        }
    }
}
