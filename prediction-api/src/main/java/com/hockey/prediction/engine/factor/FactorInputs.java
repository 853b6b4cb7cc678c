package com.hockey.prediction.engine.factor;

import com.hockey.prediction.stats.GameLogEntry;
import com.hockey.prediction.stats.GoalieContext;
import com.hockey.prediction.stats.HeadToHeadRecord;
import com.hockey.prediction.stats.PlayerSeasonRecord;
import com.hockey.prediction.stats.ScheduledGame;
import com.hockey.prediction.stats.TeamContext;

import java.util.List;

/**
 * Everything the factor calculators read for one player in one game, fetched once
 * from the statistics repository before any factor is computed.
 *
 * <p>{@code seasonRecord}, {@code ownTeam}, {@code opponentTeam} and
 * {@code opposingGoalie} are null when the repository had nothing for them.
 * Game lists are ordered most recent first.
 */
public record FactorInputs(
        long playerId,
        String playerName,
        String team,
        String opponent,
        boolean home,
        ScheduledGame game,
        PlayerSeasonRecord seasonRecord,
        List<GameLogEntry> recentGames,
        List<GameLogEntry> seasonGames,
        HeadToHeadRecord headToHead,
        TeamContext ownTeam,
        TeamContext opponentTeam,
        GoalieContext opposingGoalie
) {

    public FactorInputs {
        recentGames = List.copyOf(recentGames);
        seasonGames = List.copyOf(seasonGames);
        if (headToHead == null) {
            headToHead = HeadToHeadRecord.empty(playerId, opponent);
        }
    }

    public int gamesPlayed() {
        return seasonRecord == null ? 0 : seasonRecord.gamesPlayed();
    }

    public double seasonPointsPerGame() {
        return seasonRecord == null ? 0.0 : seasonRecord.pointsPerGame();
    }
}
