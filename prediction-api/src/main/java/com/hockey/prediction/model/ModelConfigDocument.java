package com.hockey.prediction.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A named calibration of the scoring ensemble, stored so alternative tunings can be
 * run next to the built-in model without a redeploy.
 *
 * <p>Only the values that differ from the built-in model need to be present:
 * {@code weights} keyed by factor key, {@code parameters} keyed by the
 * {@link ScoringModel} parameter names, and optionally the recent-form recency weights.
 */
@Document(collection = "model_configs")
public class ModelConfigDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String modelId;

    private String name;
    private String description;
    private boolean active;

    private Map<String, Double> weights;
    private Map<String, Object> parameters;
    private List<Double> recencyWeights;

    private Instant createdAt;
    private Instant updatedAt;

    public ModelConfigDocument() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getModelId() { return modelId; }
    public void setModelId(String modelId) { this.modelId = modelId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Map<String, Double> getWeights() { return weights; }
    public void setWeights(Map<String, Double> weights) { this.weights = weights; }

    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }

    public List<Double> getRecencyWeights() { return recencyWeights; }
    public void setRecencyWeights(List<Double> recencyWeights) { this.recencyWeights = recencyWeights; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
