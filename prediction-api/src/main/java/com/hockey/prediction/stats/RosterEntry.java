package com.hockey.prediction.stats;

/**
 * A skater who has appeared for a team this season.
 */
public record RosterEntry(long playerId, String playerName, String team) {
}
