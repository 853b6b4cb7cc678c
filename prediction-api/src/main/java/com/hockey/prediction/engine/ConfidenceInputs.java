package com.hockey.prediction.engine;

import java.util.List;

/**
 * The sample-size and consistency signals confidence is derived from.
 *
 * @param gamesPlayed     season games played
 * @param recentPoints    points per game across the recent-form window, most recent first
 * @param headToHeadGames prior meetings with the opponent
 */
public record ConfidenceInputs(int gamesPlayed, List<Integer> recentPoints, int headToHeadGames) {

    public ConfidenceInputs {
        recentPoints = List.copyOf(recentPoints);
    }
}
