package com.hockey.prediction.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Read-only season aggregate for one skater, written by the ingestion pipeline.
 * Re-ingestion replaces the document; this service never writes to the collection.
 */
@Document(collection = "player_season_stats")
public class PlayerSeasonStatsDocument {

    @Id
    private String id;

    private Long playerId;
    private String playerName;
    private String season;
    private String teamAbbrev;

    private Integer gamesPlayed;
    private Integer goals;
    private Integer assists;
    private Integer points;
    private Integer shots;

    // Advanced
    private Double expectedGoals;
    private Double corsiForPct;

    private Instant updatedAt;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }

    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }

    public String getTeamAbbrev() { return teamAbbrev; }
    public void setTeamAbbrev(String teamAbbrev) { this.teamAbbrev = teamAbbrev; }

    public Integer getGamesPlayed() { return gamesPlayed; }
    public void setGamesPlayed(Integer gamesPlayed) { this.gamesPlayed = gamesPlayed; }

    public Integer getGoals() { return goals; }
    public void setGoals(Integer goals) { this.goals = goals; }

    public Integer getAssists() { return assists; }
    public void setAssists(Integer assists) { this.assists = assists; }

    public Integer getPoints() { return points; }
    public void setPoints(Integer points) { this.points = points; }

    public Integer getShots() { return shots; }
    public void setShots(Integer shots) { this.shots = shots; }

    public Double getExpectedGoals() { return expectedGoals; }
    public void setExpectedGoals(Double expectedGoals) { this.expectedGoals = expectedGoals; }

    public Double getCorsiForPct() { return corsiForPct; }
    public void setCorsiForPct(Double corsiForPct) { this.corsiForPct = corsiForPct; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
