package com.hockey.prediction.service;

import com.hockey.prediction.exception.ResourceNotFoundException;
import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ModelConfigDocument;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.repository.ModelConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service for managing scoring model configurations.
 *
 * <p>The built-in {@value ScoringModel#DEFAULT_MODEL_ID} model comes from application
 * properties and cannot be replaced or deleted. Custom models live in MongoDB and are
 * validated every time they are created or resolved for a run.
 */
@Service
public class ModelService {

    private static final Logger log = LoggerFactory.getLogger(ModelService.class);

    private final ModelConfigRepository modelConfigRepository;
    private final ScoringModel defaultModel;

    public ModelService(ModelConfigRepository modelConfigRepository, ScoringModel defaultScoringModel) {
        this.modelConfigRepository = modelConfigRepository;
        this.defaultModel = defaultScoringModel;
    }

    /**
     * Get all available models, built-in first.
     */
    public List<ModelConfigDocument> getAllModels() {
        List<ModelConfigDocument> customModels = modelConfigRepository.findAllByOrderByModelIdAsc();
        boolean customActive = customModels.stream().anyMatch(ModelConfigDocument::isActive);

        List<ModelConfigDocument> models = new ArrayList<>(customModels.size() + 1);
        models.add(describeBuiltIn(!customActive));
        models.addAll(customModels);
        return models;
    }

    /**
     * Get a specific model by ID.
     */
    public Optional<ModelConfigDocument> getModel(String modelId) {
        if (ScoringModel.DEFAULT_MODEL_ID.equals(modelId)) {
            boolean customActive = modelConfigRepository.findFirstByActiveTrue().isPresent();
            return Optional.of(describeBuiltIn(!customActive));
        }
        return modelConfigRepository.findByModelId(modelId);
    }

    /**
     * Resolves the model a run should use: the named one, or the active one when no
     * name is given.
     *
     * @throws ResourceNotFoundException if a named model does not exist
     * @throws com.hockey.prediction.exception.InvalidScoringModelException if the stored
     *         model no longer validates
     */
    public ScoringModel resolve(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return modelConfigRepository.findFirstByActiveTrue()
                    .map(this::toScoringModel)
                    .orElse(defaultModel);
        }
        if (ScoringModel.DEFAULT_MODEL_ID.equals(modelId)) {
            return defaultModel;
        }
        return modelConfigRepository.findByModelId(modelId)
                .map(this::toScoringModel)
                .orElseThrow(() -> new ResourceNotFoundException("Model", modelId));
    }

    /**
     * Create a new custom model. Values not given are taken from the built-in model.
     */
    public ModelConfigDocument createCustomModel(String modelId, String name, String description,
                                                 Map<String, Double> weights,
                                                 Map<String, Object> parameters,
                                                 List<Double> recencyWeights) {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("Model id is required");
        }
        if (ScoringModel.DEFAULT_MODEL_ID.equals(modelId)) {
            throw new IllegalArgumentException("Cannot override built-in model: " + modelId);
        }
        if (modelConfigRepository.findByModelId(modelId).isPresent()) {
            throw new IllegalArgumentException("Model already exists: " + modelId);
        }

        ModelConfigDocument model = new ModelConfigDocument();
        model.setModelId(modelId);
        model.setName(name != null ? name : modelId);
        model.setDescription(description);
        model.setWeights(weights);
        model.setParameters(parameters);
        model.setRecencyWeights(recencyWeights);
        model.setActive(false);

        toScoringModel(model);

        ModelConfigDocument saved = modelConfigRepository.save(model);
        log.info("Created scoring model '{}'", modelId);
        return saved;
    }

    /**
     * Delete a custom model.
     */
    public boolean deleteModel(String modelId) {
        if (ScoringModel.DEFAULT_MODEL_ID.equals(modelId)) {
            throw new IllegalArgumentException("Cannot delete built-in model: " + modelId);
        }

        Optional<ModelConfigDocument> model = modelConfigRepository.findByModelId(modelId);
        if (model.isPresent()) {
            modelConfigRepository.delete(model.get());
            log.info("Deleted scoring model '{}'", modelId);
            return true;
        }
        return false;
    }

    /**
     * Set a model as active. Activating the built-in model clears the flag on every
     * custom model.
     */
    public ModelConfigDocument setActiveModel(String modelId) {
        if (ScoringModel.DEFAULT_MODEL_ID.equals(modelId)) {
            deactivateAllExcept(null);
            log.info("Active scoring model is now '{}'", modelId);
            return describeBuiltIn(true);
        }

        ModelConfigDocument model = modelConfigRepository.findByModelId(modelId)
                .orElseThrow(() -> new ResourceNotFoundException("Model", modelId));
        toScoringModel(model);

        deactivateAllExcept(modelId);
        model.setActive(true);
        model.setUpdatedAt(Instant.now());
        ModelConfigDocument saved = modelConfigRepository.save(model);
        log.info("Active scoring model is now '{}'", modelId);
        return saved;
    }

    ScoringModel toScoringModel(ModelConfigDocument document) {
        ScoringModel.Builder builder = defaultModel.toBuilder(document.getModelId())
                .weights(document.getWeights())
                .parameters(document.getParameters());
        if (document.getRecencyWeights() != null) {
            builder.recencyWeights(document.getRecencyWeights());
        }
        return builder.build();
    }

    private void deactivateAllExcept(String modelId) {
        modelConfigRepository.findByActiveTrue().forEach(m -> {
            if (!m.getModelId().equals(modelId)) {
                m.setActive(false);
                m.setUpdatedAt(Instant.now());
                modelConfigRepository.save(m);
            }
        });
    }

    private ModelConfigDocument describeBuiltIn(boolean active) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (FactorName name : FactorName.values()) {
            weights.put(name.getKey(), defaultModel.weight(name));
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(ScoringModel.POINTS_PER_GAME_CEILING, defaultModel.getPointsPerGameCeiling());
        parameters.put(ScoringModel.TEAM_PACE_CEILING, defaultModel.getTeamPaceCeiling());
        parameters.put(ScoringModel.SAVE_DIFFERENTIAL_SCALE, defaultModel.getSaveDifferentialScale());
        parameters.put(ScoringModel.HIGH_GAMES_PLAYED, defaultModel.getHighGamesPlayed());
        parameters.put(ScoringModel.MEDIUM_GAMES_PLAYED, defaultModel.getMediumGamesPlayed());
        parameters.put(ScoringModel.MIN_GAMES_PLAYED, defaultModel.getMinGamesPlayed());
        parameters.put(ScoringModel.VARIANCE_THRESHOLD, defaultModel.getVarianceThreshold());
        parameters.put(ScoringModel.HEAD_TO_HEAD_MIN_GAMES, defaultModel.getHeadToHeadMinGames());
        parameters.put(ScoringModel.VENUE_MIN_GAMES, defaultModel.getVenueMinGames());
        parameters.put(ScoringModel.LEAGUE_AVERAGE_SAVE_PCT, defaultModel.getLeagueAverageSavePct());
        parameters.put(ScoringModel.LEAGUE_AVERAGE_GOALS_PER_GAME, defaultModel.getLeagueAverageGoalsPerGame());

        ModelConfigDocument model = new ModelConfigDocument();
        model.setModelId(ScoringModel.DEFAULT_MODEL_ID);
        model.setName("Default");
        model.setDescription("Built-in calibration from application configuration");
        model.setWeights(weights);
        model.setParameters(parameters);
        model.setRecencyWeights(defaultModel.getRecencyWeights());
        model.setActive(active);
        return model;
    }
}
