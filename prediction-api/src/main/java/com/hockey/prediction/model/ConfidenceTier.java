package com.hockey.prediction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse reliability label of a prediction. Declared weakest first so that
 * {@link #compareTo} orders tiers by strength.
 */
public enum ConfidenceTier {

    LOW,
    MEDIUM,
    HIGH;

    public ConfidenceTier atMost(ConfidenceTier cap) {
        return compareTo(cap) > 0 ? cap : this;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
