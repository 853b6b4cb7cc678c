package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Points-per-game this season at the venue type of the target game.
 */
@Component
public class HomeAwaySplitCalculator implements FactorCalculator {

    @Override
    public FactorName name() {
        return FactorName.HOME_AWAY;
    }

    @Override
    public ScoringFactor calculate(FactorInputs inputs, ScoringModel model) {
        List<GameLogEntry> sameVenue = inputs.seasonGames().stream()
                .filter(g -> g.home() == inputs.home())
                .collect(Collectors.toList());
        if (sameVenue.size() < model.getVenueMinGames()) {
            return ScoringFactor.fallback(name(), SeasonBaselineCalculator.baselineScore(inputs, model),
                    model.weight(name()), sameVenue.size());
        }
        double ppg = Normalization.pointsPerGame(sameVenue);
        return ScoringFactor.computed(name(),
                Normalization.againstCeiling(ppg, model.getPointsPerGameCeiling()),
                model.weight(name()), sameVenue.size());
    }
}
