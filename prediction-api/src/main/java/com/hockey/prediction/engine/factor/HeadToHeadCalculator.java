package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.HeadToHeadRecord;
import org.springframework.stereotype.Component;

/**
 * Points-per-game in prior meetings with the scheduled opponent; season baseline
 * below the head-to-head sample cutoff.
 */
@Component
public class HeadToHeadCalculator implements FactorCalculator {

    @Override
    public FactorName name() {
        return FactorName.HEAD_TO_HEAD;
    }

    @Override
    public ScoringFactor calculate(FactorInputs inputs, ScoringModel model) {
        HeadToHeadRecord h2h = inputs.headToHead();
        if (h2h.sampleSize() < model.getHeadToHeadMinGames()) {
            return ScoringFactor.fallback(name(), SeasonBaselineCalculator.baselineScore(inputs, model),
                    model.weight(name()), h2h.sampleSize());
        }
        return ScoringFactor.computed(name(),
                Normalization.againstCeiling(h2h.pointsPerGame(), model.getPointsPerGameCeiling()),
                model.weight(name()), h2h.sampleSize());
    }
}
