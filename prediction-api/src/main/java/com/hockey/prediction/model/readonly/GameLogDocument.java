package com.hockey.prediction.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Read-only per-game line for one player.
 */
@Document(collection = "game_logs")
public class GameLogDocument {

    @Id
    private String id;

    private Long playerId;
    private String playerName;
    private Long gameId;
    private LocalDate gameDate;
    private String season;
    private String teamAbbrev;
    private String opponent;
    private String homeAway;    // "home" or "away"

    private Integer goals;
    private Integer assists;
    private Integer points;
    private Integer shots;
    private Double toi;         // decimal minutes

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }

    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }

    public LocalDate getGameDate() { return gameDate; }
    public void setGameDate(LocalDate gameDate) { this.gameDate = gameDate; }

    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }

    public String getTeamAbbrev() { return teamAbbrev; }
    public void setTeamAbbrev(String teamAbbrev) { this.teamAbbrev = teamAbbrev; }

    public String getOpponent() { return opponent; }
    public void setOpponent(String opponent) { this.opponent = opponent; }

    public String getHomeAway() { return homeAway; }
    public void setHomeAway(String homeAway) { this.homeAway = homeAway; }

    public Integer getGoals() { return goals; }
    public void setGoals(Integer goals) { this.goals = goals; }

    public Integer getAssists() { return assists; }
    public void setAssists(Integer assists) { this.assists = assists; }

    public Integer getPoints() { return points; }
    public void setPoints(Integer points) { this.points = points; }

    public Integer getShots() { return shots; }
    public void setShots(Integer shots) { this.shots = shots; }

    public Double getToi() { return toi; }
    public void setToi(Double toi) { this.toi = toi; }
}
