package com.hockey.prediction.exception;

/**
 * A slate run was cancelled or interrupted before every player was scored.
 */
public class PredictionRunAbortedException extends RuntimeException {

    public PredictionRunAbortedException(String message) {
        super(message);
    }

    public PredictionRunAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
