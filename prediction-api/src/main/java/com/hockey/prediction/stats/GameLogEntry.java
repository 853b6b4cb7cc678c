package com.hockey.prediction.stats;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * One player's line in one played game.
 */
public record GameLogEntry(
        long playerId,
        long gameId,
        LocalDate gameDate,
        String team,
        String opponent,
        boolean home,
        int goals,
        int assists,
        int points,
        int shots,
        double timeOnIce
) {

    /**
     * Newest first; same-day games ordered by game id, higher id first.
     */
    public static final Comparator<GameLogEntry> MOST_RECENT_FIRST =
            Comparator.comparing(GameLogEntry::gameDate)
                    .thenComparingLong(GameLogEntry::gameId)
                    .reversed();
}
