package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;

/**
 * Computes one normalized sub-score of the ensemble.
 *
 * <p>Implementations are stateless and never throw for missing data: when their signal
 * is absent or too thin they return a {@link ScoringFactor#fallback fallback} factor.
 */
public interface FactorCalculator {

    FactorName name();

    ScoringFactor calculate(FactorInputs inputs, ScoringModel model);
}
