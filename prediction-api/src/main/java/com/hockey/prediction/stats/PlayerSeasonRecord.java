package com.hockey.prediction.stats;

import java.util.List;

/**
 * Season-to-date aggregate for one skater.
 *
 * @param expectedGoals season expected goals, null when not tracked
 * @param corsiForPct   Corsi-for percentage, null when not tracked
 */
public record PlayerSeasonRecord(
        long playerId,
        String playerName,
        String season,
        String team,
        int gamesPlayed,
        int goals,
        int assists,
        int points,
        int shots,
        Double expectedGoals,
        Double corsiForPct
) {

    public double pointsPerGame() {
        return gamesPlayed > 0 ? (double) points / gamesPlayed : 0.0;
    }

    /**
     * Aggregates a season record from game log rows when no ingested aggregate exists.
     */
    public static PlayerSeasonRecord fromGameLog(long playerId, String playerName, String season,
                                                 String team, List<GameLogEntry> games) {
        int goals = 0;
        int assists = 0;
        int points = 0;
        int shots = 0;
        for (GameLogEntry g : games) {
            goals += g.goals();
            assists += g.assists();
            points += g.points();
            shots += g.shots();
        }
        return new PlayerSeasonRecord(playerId, playerName, season, team, games.size(),
                goals, assists, points, shots, null, null);
    }
}
