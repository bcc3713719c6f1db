package com.shieldmail.spamengine.api;

import com.shieldmail.spamengine.api.dto.PredictionResponse;
import com.shieldmail.spamengine.api.dto.StatsResponse;
import com.shieldmail.spamengine.domain.model.PredictionStats;
import com.shieldmail.spamengine.domain.service.PredictionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
@CrossOrigin(origins = {
        "http://localhost:3000", "http://localhost:5173",
        "http://127.0.0.1:3000", "http://127.0.0.1:5173"})
public class StatsController {

    private final PredictionService predictionService;
    private final ApiProperties apiProperties;

    @GetMapping
    public ResponseEntity<StatsResponse> getStats() {
        PredictionStats stats = predictionService.stats();
        return ResponseEntity.ok(new StatsResponse(
                stats.getTotalPredictions(),
                stats.getSpamCount(),
                stats.getSafeCount(),
                stats.getAccuracyFeedback(),
                stats.getRecentPredictions().stream()
                        .map(r -> PredictionResponse.from(r, apiProperties.getPreviewLength()))
                        .toList()));
    }
}
