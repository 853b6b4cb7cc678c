package com.hockey.prediction.model;

import java.math.BigDecimal;

/**
 * One normalized sub-score of the ensemble.
 *
 * <p>A factor is either {@link Source#COMPUTED computed} from the specific signal it
 * describes or {@link Source#FALLBACK} when a less specific value was substituted for
 * missing or thin data. Fallback is an expected outcome, not an error.
 *
 * @param name       which of the six signals this is
 * @param score      normalized score, always within [0, 1]
 * @param weight     ensemble weight the score was combined with
 * @param sampleSize number of games (or records) the score was derived from
 * @param source     whether the value was computed or substituted
 */
public record ScoringFactor(
        FactorName name,
        double score,
        double weight,
        int sampleSize,
        Source source
) {

    public enum Source {
        COMPUTED,
        FALLBACK
    }

    public ScoringFactor {
        if (name == null || source == null) {
            throw new IllegalArgumentException("Factor name and source are required");
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score for " + name.getKey() + " outside [0,1]: " + score);
        }
        if (sampleSize < 0) {
            throw new IllegalArgumentException("Negative sample size for " + name.getKey());
        }
    }

    public static ScoringFactor computed(FactorName name, double score, double weight, int sampleSize) {
        return new ScoringFactor(name, score, weight, sampleSize, Source.COMPUTED);
    }

    public static ScoringFactor fallback(FactorName name, double score, double weight, int sampleSize) {
        return new ScoringFactor(name, score, weight, sampleSize, Source.FALLBACK);
    }

    public boolean isFallbackUsed() {
        return source == Source.FALLBACK;
    }

    /**
     * Exact decimal product of score and weight.
     */
    public BigDecimal contribution() {
        return BigDecimal.valueOf(score).multiply(BigDecimal.valueOf(weight));
    }
}
