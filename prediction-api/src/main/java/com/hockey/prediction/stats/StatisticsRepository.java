package com.hockey.prediction.stats;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to ingested statistics.
 *
 * <p>Ordinary absence of data is never an error: lookups return {@link Optional#empty()},
 * empty lists, an empty {@link HeadToHeadRecord} or an unannounced {@link GoalieContext}.
 * Implementations throw {@link com.hockey.prediction.exception.StatisticsUnavailableException}
 * only when the store cannot be read or returns malformed records.
 *
 * <p>Implementations must be safe for any number of concurrent readers.
 */
public interface StatisticsRepository {

    Optional<PlayerSeasonRecord> getSeasonRecord(long playerId, String season);

    /**
     * Up to {@code limit} most recent games played strictly before {@code asOf},
     * ordered by {@link GameLogEntry#MOST_RECENT_FIRST}.
     */
    List<GameLogEntry> getRecentGames(long playerId, int limit, LocalDate asOf);

    /**
     * All games of the season played strictly before {@code asOf}, most recent first.
     */
    List<GameLogEntry> getSeasonGames(long playerId, String season, LocalDate asOf);

    HeadToHeadRecord getHeadToHead(long playerId, String opponent, LocalDate asOf);

    Optional<TeamContext> getTeamContext(String team, String season);

    GoalieContext getGoalieContext(String team, LocalDate asOf);

    List<ScheduledGame> getScheduledGames(LocalDate date);

    /**
     * The team a player currently plays for: the team of the season record, else the team
     * of the player's latest game of the season. Empty when the player has neither.
     */
    Optional<String> getCurrentTeam(long playerId, String season);

    /**
     * Skaters whose {@link #getCurrentTeam current team} is the team, ordered by player id.
     */
    List<RosterEntry> getRoster(String team, String season);
}
