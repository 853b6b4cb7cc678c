package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import org.springframework.stereotype.Component;

/**
 * Expected scoring environment: own goals-for plus opponent goals-against per game,
 * against the pace ceiling. A missing team side is replaced by the league average
 * goals per team-game.
 */
@Component
public class TeamPaceCalculator implements FactorCalculator {

    @Override
    public FactorName name() {
        return FactorName.TEAM_PACE;
    }

    @Override
    public ScoringFactor calculate(FactorInputs inputs, ScoringModel model) {
        int available = 0;
        double goalsFor = model.getLeagueAverageGoalsPerGame();
        double goalsAgainst = model.getLeagueAverageGoalsPerGame();
        if (inputs.ownTeam() != null) {
            goalsFor = inputs.ownTeam().goalsForPerGame();
            available++;
        }
        if (inputs.opponentTeam() != null) {
            goalsAgainst = inputs.opponentTeam().goalsAgainstPerGame();
            available++;
        }
        double score = Normalization.againstCeiling(goalsFor + goalsAgainst, model.getTeamPaceCeiling());
        return available == 2
                ? ScoringFactor.computed(name(), score, model.weight(name()), available)
                : ScoringFactor.fallback(name(), score, model.weight(name()), available);
    }
}
