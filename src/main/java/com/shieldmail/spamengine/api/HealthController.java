package com.shieldmail.spamengine.api;

import com.shieldmail.spamengine.domain.service.ModelService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@CrossOrigin(origins = {
        "http://localhost:3000", "http://localhost:5173",
        "http://127.0.0.1:3000", "http://127.0.0.1:5173"})
public class HealthController {

    private final ModelService modelService;
    private final Clock clock;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("predict", "POST /api/predict");
        endpoints.put("batch_predict", "POST /api/batch-predict");
        endpoints.put("predictions", "GET /api/predictions");
        endpoints.put("prediction_by_id", "GET /api/predictions/{prediction_id}");
        endpoints.put("explanation", "GET /api/predictions/{prediction_id}/explanation");
        endpoints.put("update_prediction", "PUT /api/predictions/{prediction_id}");
        endpoints.put("delete_prediction", "DELETE /api/predictions/{prediction_id}");
        endpoints.put("stats", "GET /api/stats");
        endpoints.put("health", "GET /api/health");
        endpoints.put("model_info", "GET /api/model/info");

        return ResponseEntity.ok(Map.of(
                "message", "Welcome to ShieldMail API",
                "version", "1.0.0",
                "status", "active",
                "endpoints", endpoints));
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "model_loaded", modelService.isLoaded(),
                "timestamp", LocalDateTime.now(clock).toString(),
                "model_info", modelService.getModelInfo()));
    }

    @GetMapping("/api/model/info")
    public ResponseEntity<Map<String, Object>> modelInfo() {
        return ResponseEntity.ok(Map.of(
                "status", "active",
                "model_info", modelService.getModelInfo(),
                "timestamp", LocalDateTime.now(clock).toString()));
    }
}
