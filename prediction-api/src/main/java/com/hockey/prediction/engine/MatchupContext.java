package com.hockey.prediction.engine;

import com.hockey.prediction.stats.GoalieContext;
import com.hockey.prediction.stats.RosterEntry;
import com.hockey.prediction.stats.ScheduledGame;
import com.hockey.prediction.stats.TeamContext;

import java.util.List;

/**
 * Per-game data shared by every player in that game. Team contexts are null when the
 * repository has none.
 */
public record MatchupContext(
        ScheduledGame game,
        TeamContext homeTeam,
        TeamContext awayTeam,
        GoalieContext homeGoalie,
        GoalieContext awayGoalie,
        List<RosterEntry> homeRoster,
        List<RosterEntry> awayRoster
) {

    public MatchupContext {
        homeRoster = List.copyOf(homeRoster);
        awayRoster = List.copyOf(awayRoster);
    }

    public boolean isHomeTeam(String team) {
        return game.homeTeam().equalsIgnoreCase(team);
    }
}
