package com.hockey.prediction.stats;

/**
 * The goalie a team is expected to start on a date.
 *
 * <p>{@code goalieId}, {@code goalieName} and {@code savePct} are null while the starter
 * is unannounced. {@code leagueAverageSavePct} is null when the league figure could not
 * be derived from the repository.
 */
public record GoalieContext(
        String team,
        Long goalieId,
        String goalieName,
        Double savePct,
        Double leagueAverageSavePct
) {

    public static GoalieContext unannounced(String team, Double leagueAverageSavePct) {
        return new GoalieContext(team, null, null, null, leagueAverageSavePct);
    }

    public boolean isStarterAnnounced() {
        return goalieId != null && savePct != null;
    }
}
