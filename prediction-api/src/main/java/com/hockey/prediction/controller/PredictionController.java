package com.hockey.prediction.controller;

import com.hockey.prediction.exception.ResourceNotFoundException;
import com.hockey.prediction.model.ModelConfigDocument;
import com.hockey.prediction.model.PredictionResult;
import com.hockey.prediction.service.ModelService;
import com.hockey.prediction.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/predictions")
@Tag(name = "Predictions", description = "Player scoring prediction endpoints")
public class PredictionController {

    private final PredictionService predictionService;
    private final ModelService modelService;

    public PredictionController(PredictionService predictionService, ModelService modelService) {
        this.predictionService = predictionService;
        this.modelService = modelService;
    }

    // ============ PREDICTIONS ============

    @GetMapping("/slate")
    @Operation(summary = "Rank a slate", description = "Rank every eligible player scheduled on a date (today when omitted)")
    public List<PredictionResult> predictSlate(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String modelId,
            @RequestParam(required = false) Integer limit
    ) {
        return predictionService.predictSlate(date, modelId, limit);
    }

    @GetMapping("/matchup/{teamA}/{teamB}")
    @Operation(summary = "Rank a matchup", description = "Rank the players of the game between two teams")
    public List<PredictionResult> predictMatchup(
            @PathVariable String teamA,
            @PathVariable String teamB,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String modelId,
            @RequestParam(required = false) Integer limit
    ) {
        return predictionService.predictMatchup(teamA, teamB, date, modelId, limit);
    }

    @GetMapping("/player/{playerId}")
    @Operation(summary = "Predict one player", description = "Prediction for one player, ranked within their game")
    public PredictionResult predictPlayer(
            @PathVariable long playerId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String modelId
    ) {
        return predictionService.predictPlayer(playerId, date, modelId);
    }

    // ============ MODELS ============

    @GetMapping("/models")
    @Operation(summary = "Get all models", description = "Retrieve the built-in and custom scoring models")
    public List<ModelConfigDocument> getAllModels() {
        return modelService.getAllModels();
    }

    @GetMapping("/models/{modelId}")
    @Operation(summary = "Get model by ID", description = "Retrieve a specific scoring model")
    public ModelConfigDocument getModel(@PathVariable String modelId) {
        return modelService.getModel(modelId)
                .orElseThrow(() -> new ResourceNotFoundException("Model", modelId));
    }

    @PostMapping("/models")
    @Operation(summary = "Create custom model", description = "Create a scoring model; omitted values come from the built-in model")
    public ResponseEntity<ModelConfigDocument> createModel(@RequestBody CreateModelRequest request) {
        ModelConfigDocument created = modelService.createCustomModel(
                request.modelId(),
                request.name(),
                request.description(),
                request.weights(),
                request.parameters(),
                request.recencyWeights()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/models/{modelId}/activate")
    @Operation(summary = "Set active model", description = "Use a model when a request names none")
    public ModelConfigDocument setActiveModel(@PathVariable String modelId) {
        return modelService.setActiveModel(modelId);
    }

    @DeleteMapping("/models/{modelId}")
    @Operation(summary = "Delete custom model", description = "Delete a custom model (the built-in model cannot be deleted)")
    public ResponseEntity<Void> deleteModel(@PathVariable String modelId) {
        if (modelService.deleteModel(modelId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    // ============ REQUEST/RESPONSE CLASSES ============

    public record CreateModelRequest(
            String modelId,
            String name,
            String description,
            Map<String, Double> weights,
            Map<String, Object> parameters,
            List<Double> recencyWeights
    ) {}
}
