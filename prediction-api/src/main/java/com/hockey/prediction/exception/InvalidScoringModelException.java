package com.hockey.prediction.exception;

/**
 * Thrown when a scoring model's weights, ceilings or thresholds are unusable.
 */
public class InvalidScoringModelException extends RuntimeException {

    public InvalidScoringModelException(String message) {
        super(message);
    }

    public InvalidScoringModelException(String modelId, String problem) {
        super(String.format("Invalid scoring model '%s': %s", modelId, problem));
    }
}
