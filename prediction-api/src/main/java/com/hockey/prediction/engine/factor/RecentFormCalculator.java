package com.hockey.prediction.engine.factor;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recency-weighted points-per-game over the last games played.
 *
 * <p>The i-th most recent game gets the i-th configured recency weight (linear
 * 5/4/3/2/1 by default). With fewer games than the window, only the leading weights
 * are used and the average is taken over their sum. With no prior games the season
 * baseline is substituted.
 */
@Component
public class RecentFormCalculator implements FactorCalculator {

    @Override
    public FactorName name() {
        return FactorName.RECENT_FORM;
    }

    @Override
    public ScoringFactor calculate(FactorInputs inputs, ScoringModel model) {
        List<GameLogEntry> window = window(inputs.recentGames(), model);
        if (window.isEmpty()) {
            return ScoringFactor.fallback(name(), SeasonBaselineCalculator.baselineScore(inputs, model),
                    model.weight(name()), 0);
        }
        double ppg = weightedPointsPerGame(window, model.getRecencyWeights());
        return ScoringFactor.computed(name(),
                Normalization.againstCeiling(ppg, model.getPointsPerGameCeiling()),
                model.weight(name()), window.size());
    }

    static List<GameLogEntry> window(List<GameLogEntry> recentGames, ScoringModel model) {
        int size = Math.min(recentGames.size(), model.getRecentFormWindow());
        return recentGames.subList(0, size);
    }

    static double weightedPointsPerGame(List<GameLogEntry> mostRecentFirst, List<Double> recencyWeights) {
        double weightedPoints = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < mostRecentFirst.size(); i++) {
            double w = recencyWeights.get(i);
            weightedPoints += mostRecentFirst.get(i).points() * w;
            totalWeight += w;
        }
        return totalWeight > 0 ? weightedPoints / totalWeight : 0.0;
    }
}
