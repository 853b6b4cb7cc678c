package com.hockey.prediction.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only team aggregate for a season.
 */
@Document(collection = "team_season_stats")
public class TeamSeasonStatsDocument {

    @Id
    private String id;

    private String teamAbbrev;
    private String season;
    private Integer gamesPlayed;
    private Double goalsForPerGame;
    private Double goalsAgainstPerGame;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTeamAbbrev() { return teamAbbrev; }
    public void setTeamAbbrev(String teamAbbrev) { this.teamAbbrev = teamAbbrev; }

    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }

    public Integer getGamesPlayed() { return gamesPlayed; }
    public void setGamesPlayed(Integer gamesPlayed) { this.gamesPlayed = gamesPlayed; }

    public Double getGoalsForPerGame() { return goalsForPerGame; }
    public void setGoalsForPerGame(Double goalsForPerGame) { this.goalsForPerGame = goalsForPerGame; }

    public Double getGoalsAgainstPerGame() { return goalsAgainstPerGame; }
    public void setGoalsAgainstPerGame(Double goalsAgainstPerGame) { this.goalsAgainstPerGame = goalsAgainstPerGame; }
}
