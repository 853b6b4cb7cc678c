package com.hockey.prediction.stats;

import java.util.List;

/**
 * A player's prior games against one opponent.
 */
public record HeadToHeadRecord(long playerId, String opponent, List<GameLogEntry> games) {

    public HeadToHeadRecord {
        games = List.copyOf(games);
    }

    public static HeadToHeadRecord empty(long playerId, String opponent) {
        return new HeadToHeadRecord(playerId, opponent, List.of());
    }

    public int sampleSize() {
        return games.size();
    }

    public double pointsPerGame() {
        if (games.isEmpty()) {
            return 0.0;
        }
        int points = 0;
        for (GameLogEntry g : games) {
            points += g.points();
        }
        return (double) points / games.size();
    }
}
