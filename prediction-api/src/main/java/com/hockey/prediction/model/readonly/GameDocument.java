package com.hockey.prediction.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Read-only schedule entry.
 */
@Document(collection = "games")
public class GameDocument {

    @Id
    private String id;

    private Long gameId;
    private String season;
    private Integer gameType;   // 2 = regular season, 3 = playoffs
    private LocalDate gameDate;
    private String venue;
    private String homeTeamAbbrev;
    private String awayTeamAbbrev;
    private String gameState;   // FUT, LIVE, FINAL, OFF

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }

    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }

    public Integer getGameType() { return gameType; }
    public void setGameType(Integer gameType) { this.gameType = gameType; }

    public LocalDate getGameDate() { return gameDate; }
    public void setGameDate(LocalDate gameDate) { this.gameDate = gameDate; }

    public String getVenue() { return venue; }
    public void setVenue(String venue) { this.venue = venue; }

    public String getHomeTeamAbbrev() { return homeTeamAbbrev; }
    public void setHomeTeamAbbrev(String homeTeamAbbrev) { this.homeTeamAbbrev = homeTeamAbbrev; }

    public String getAwayTeamAbbrev() { return awayTeamAbbrev; }
    public void setAwayTeamAbbrev(String awayTeamAbbrev) { this.awayTeamAbbrev = awayTeamAbbrev; }

    public String getGameState() { return gameState; }
    public void setGameState(String gameState) { this.gameState = gameState; }
}
