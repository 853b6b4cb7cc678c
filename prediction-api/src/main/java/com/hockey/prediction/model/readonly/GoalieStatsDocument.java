package com.hockey.prediction.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only season line for a goalie.
 */
@Document(collection = "goalie_stats")
public class GoalieStatsDocument {

    @Id
    private String id;

    private Long playerId;
    private String playerName;
    private String teamAbbrev;
    private String season;
    private Integer gamesStarted;
    private Double savePct;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }

    public String getTeamAbbrev() { return teamAbbrev; }
    public void setTeamAbbrev(String teamAbbrev) { this.teamAbbrev = teamAbbrev; }

    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }

    public Integer getGamesStarted() { return gamesStarted; }
    public void setGamesStarted(Integer gamesStarted) { this.gamesStarted = gamesStarted; }

    public Double getSavePct() { return savePct; }
    public void setSavePct(Double savePct) { this.savePct = savePct; }
}
