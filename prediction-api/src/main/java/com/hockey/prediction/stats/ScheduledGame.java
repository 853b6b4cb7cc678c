package com.hockey.prediction.stats;

import java.time.LocalDate;

/**
 * A game on the schedule.
 */
public record ScheduledGame(
        long gameId,
        LocalDate gameDate,
        String season,
        String homeTeam,
        String awayTeam,
        String venue
) {

    public boolean involves(String team) {
        return homeTeam.equalsIgnoreCase(team) || awayTeam.equalsIgnoreCase(team);
    }

    public boolean isBetween(String teamA, String teamB) {
        return (homeTeam.equalsIgnoreCase(teamA) && awayTeam.equalsIgnoreCase(teamB))
                || (homeTeam.equalsIgnoreCase(teamB) && awayTeam.equalsIgnoreCase(teamA));
    }
}
