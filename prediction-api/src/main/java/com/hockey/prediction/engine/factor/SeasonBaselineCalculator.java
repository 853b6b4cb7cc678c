package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import org.springframework.stereotype.Component;

/**
 * Season points-per-game against the points ceiling. Also the substitute score for
 * the more specific per-game factors when their samples are too small.
 */
@Component
public class SeasonBaselineCalculator implements FactorCalculator {

    @Override
    public FactorName name() {
        return FactorName.SEASON_BASELINE;
    }

    @Override
    public ScoringFactor calculate(FactorInputs inputs, ScoringModel model) {
        return ScoringFactor.computed(name(), baselineScore(inputs, model),
                model.weight(name()), inputs.gamesPlayed());
    }

    static double baselineScore(FactorInputs inputs, ScoringModel model) {
        return Normalization.againstCeiling(inputs.seasonPointsPerGame(), model.getPointsPerGameCeiling());
    }
}
