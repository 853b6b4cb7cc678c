package com.hockey.prediction.exception;

/**
 * The statistics store could not be read or returned a malformed record.
 * Fatal to the prediction run that hit it.
 */
public class StatisticsUnavailableException extends RuntimeException {

    public StatisticsUnavailableException(String message) {
        super(message);
    }

    public StatisticsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
