package com.hockey.prediction.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Scoring forecast for one player in one game.
 *
 * <p>{@code compositeScore} is the weighted sum of {@code factors} and nothing else;
 * {@code confidence} is derived from sample sizes and form variance only. {@code rank}
 * is 0 until the result is placed in a ranked slate.
 */
public record PredictionResult(
        long playerId,
        String playerName,
        String team,
        String opponent,
        boolean home,
        long gameId,
        LocalDate gameDate,
        double compositeScore,
        ConfidenceTier confidence,
        List<ScoringFactor> factors,
        List<String> highlights,
        int rank
) {

    public PredictionResult {
        factors = List.copyOf(factors);
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }

    public PredictionResult withRank(int position) {
        return new PredictionResult(playerId, playerName, team, opponent, home, gameId, gameDate,
                compositeScore, confidence, factors, highlights, position);
    }

    public ScoringFactor factor(FactorName name) {
        return factors.stream()
                .filter(f -> f.name() == name)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No " + name.getKey() + " factor for player " + playerId));
    }
}
