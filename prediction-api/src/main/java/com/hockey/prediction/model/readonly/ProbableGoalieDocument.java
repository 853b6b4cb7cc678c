package com.hockey.prediction.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Read-only probable starter announcement for a team on a game date.
 */
@Document(collection = "probable_goalies")
public class ProbableGoalieDocument {

    @Id
    private String id;

    private Long gameId;
    private LocalDate gameDate;
    private String teamAbbrev;
    private Long goalieId;
    private boolean confirmed;
    private String source;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }

    public LocalDate getGameDate() { return gameDate; }
    public void setGameDate(LocalDate gameDate) { this.gameDate = gameDate; }

    public String getTeamAbbrev() { return teamAbbrev; }
    public void setTeamAbbrev(String teamAbbrev) { this.teamAbbrev = teamAbbrev; }

    public Long getGoalieId() { return goalieId; }
    public void setGoalieId(Long goalieId) { this.goalieId = goalieId; }

    public boolean isConfirmed() { return confirmed; }
    public void setConfirmed(boolean confirmed) { this.confirmed = confirmed; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
}
