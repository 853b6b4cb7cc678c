package com.hockey.prediction.stats;

/**
 * Season-to-date scoring rates for a team, used for pace estimation.
 */
public record TeamContext(String team, String season, double goalsForPerGame, double goalsAgainstPerGame) {
}
