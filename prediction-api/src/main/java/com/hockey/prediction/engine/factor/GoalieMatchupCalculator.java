package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GoalieContext;
import org.springframework.stereotype.Component;

/**
 * Opposing starter's save percentage relative to the league:
 * {@code 1 - (savePct - leagueAverage) * saveDifferentialScale}, clamped to [0,1].
 * Neutral 0.5 while the starter is unannounced.
 */
@Component
public class GoalieMatchupCalculator implements FactorCalculator {

    @Override
    public FactorName name() {
        return FactorName.GOALIE_MATCHUP;
    }

    @Override
    public ScoringFactor calculate(FactorInputs inputs, ScoringModel model) {
        GoalieContext goalie = inputs.opposingGoalie();
        if (goalie == null || !goalie.isStarterAnnounced()) {
            return ScoringFactor.fallback(name(), Normalization.NEUTRAL, model.weight(name()), 0);
        }
        double leagueAverage = goalie.leagueAverageSavePct() != null
                ? goalie.leagueAverageSavePct()
                : model.getLeagueAverageSavePct();
        double differential = goalie.savePct() - leagueAverage;
        double score = Normalization.clamp(1.0 - differential * model.getSaveDifferentialScale());
        return ScoringFactor.computed(name(), score, model.weight(name()), 1);
    }
}
