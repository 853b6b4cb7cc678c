package com.hockey.prediction.controller;

import com.hockey.prediction.repository.ModelConfigRepository;
import com.hockey.prediction.repository.readonly.GameReadRepository;
import com.hockey.prediction.repository.readonly.PlayerSeasonStatsReadRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final GameReadRepository gameRepository;
    private final PlayerSeasonStatsReadRepository playerSeasonStatsRepository;
    private final ModelConfigRepository modelConfigRepository;

    public HealthController(
            GameReadRepository gameRepository,
            PlayerSeasonStatsReadRepository playerSeasonStatsRepository,
            ModelConfigRepository modelConfigRepository
    ) {
        this.gameRepository = gameRepository;
        this.playerSeasonStatsRepository = playerSeasonStatsRepository;
        this.modelConfigRepository = modelConfigRepository;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and statistics store connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        // Ingested statistics (read-only)
        try {
            health.put("gameCount", gameRepository.count());
            health.put("playerSeasonCount", playerSeasonStatsRepository.count());
            health.put("statisticsAccess", "OK");
        } catch (Exception e) {
            health.put("status", "DEGRADED");
            health.put("statisticsAccess", "ERROR: " + e.getMessage());
        }

        try {
            health.put("customModelCount", modelConfigRepository.count());
            health.put("modelAccess", "OK");
        } catch (Exception e) {
            health.put("status", "DEGRADED");
            health.put("modelAccess", "ERROR: " + e.getMessage());
        }

        return health;
    }
}
