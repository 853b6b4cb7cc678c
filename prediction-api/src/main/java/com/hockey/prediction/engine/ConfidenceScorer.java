package com.hockey.prediction.engine;

import com.hockey.prediction.model.ConfidenceTier;
import com.hockey.prediction.model.ScoringModel;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assigns a confidence tier from sample sizes and form consistency. The composite
 * score is never an input, so a strong forecast can still carry low confidence.
 *
 * <p>Checks run in order, each able only to lower the tier:
 * <ol>
 *   <li>games played: {@code >= high} cutoff gives HIGH, {@code >= medium} gives MEDIUM,
 *       otherwise LOW;</li>
 *   <li>population variance of recent points above the threshold caps at MEDIUM;</li>
 *   <li>fewer prior meetings than the head-to-head cutoff caps at MEDIUM, never lower.</li>
 * </ol>
 */
@Component
public class ConfidenceScorer {

    public ConfidenceTier score(ConfidenceInputs inputs, ScoringModel model) {
        ConfidenceTier tier;
        if (inputs.gamesPlayed() >= model.getHighGamesPlayed()) {
            tier = ConfidenceTier.HIGH;
        } else if (inputs.gamesPlayed() >= model.getMediumGamesPlayed()) {
            tier = ConfidenceTier.MEDIUM;
        } else {
            return ConfidenceTier.LOW;
        }

        if (variance(inputs.recentPoints()) > model.getVarianceThreshold()) {
            tier = tier.atMost(ConfidenceTier.MEDIUM);
        }
        if (inputs.headToHeadGames() < model.getHeadToHeadMinGames()) {
            tier = tier.atMost(ConfidenceTier.MEDIUM);
        }
        return tier;
    }

    static double variance(List<Integer> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (int v : values) {
            sum += v;
        }
        double mean = sum / values.size();
        double squares = 0.0;
        for (int v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / values.size();
    }
}
