package com.hockey.prediction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The six signals combined by the scoring ensemble, in aggregation order.
 */
public enum FactorName {

    RECENT_FORM("recentForm"),
    SEASON_BASELINE("seasonBaseline"),
    HEAD_TO_HEAD("headToHead"),
    HOME_AWAY("homeAway"),
    GOALIE_MATCHUP("goalieMatchup"),
    TEAM_PACE("teamPace");

    private final String key;

    FactorName(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static Optional<FactorName> fromKey(String key) {
        for (FactorName name : values()) {
            if (name.key.equals(key)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
