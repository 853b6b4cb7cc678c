package com.hockey.prediction.stats;

import com.hockey.prediction.exception.StatisticsUnavailableException;
import com.hockey.prediction.model.readonly.GameDocument;
import com.hockey.prediction.model.readonly.GameLogDocument;
import com.hockey.prediction.model.readonly.GoalieStatsDocument;
import com.hockey.prediction.model.readonly.PlayerSeasonStatsDocument;
import com.hockey.prediction.model.readonly.ProbableGoalieDocument;
import com.hockey.prediction.model.readonly.TeamSeasonStatsDocument;
import com.hockey.prediction.repository.readonly.GameLogReadRepository;
import com.hockey.prediction.repository.readonly.GameReadRepository;
import com.hockey.prediction.repository.readonly.GoalieStatsReadRepository;
import com.hockey.prediction.repository.readonly.PlayerSeasonStatsReadRepository;
import com.hockey.prediction.repository.readonly.ProbableGoalieReadRepository;
import com.hockey.prediction.repository.readonly.TeamSeasonStatsReadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MongoStatisticsRepositoryTest {

    private static final String SEASON = "20232024";
    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    PlayerSeasonStatsReadRepository seasonStats;
    GameLogReadRepository gameLogs;
    TeamSeasonStatsReadRepository teamStats;
    GoalieStatsReadRepository goalieStats;
    ProbableGoalieReadRepository probableGoalies;
    GameReadRepository games;

    MongoStatisticsRepository repository;

    @BeforeEach
    void setUp() {
        seasonStats = mock(PlayerSeasonStatsReadRepository.class);
        gameLogs = mock(GameLogReadRepository.class);
        teamStats = mock(TeamSeasonStatsReadRepository.class);
        goalieStats = mock(GoalieStatsReadRepository.class);
        probableGoalies = mock(ProbableGoalieReadRepository.class);
        games = mock(GameReadRepository.class);
        repository = new MongoStatisticsRepository(seasonStats, gameLogs, teamStats, goalieStats, probableGoalies, games);
    }

    private static PlayerSeasonStatsDocument seasonDoc(long playerId, String team, int gp, int points) {
        PlayerSeasonStatsDocument doc = new PlayerSeasonStatsDocument();
        doc.setPlayerId(playerId);
        doc.setPlayerName("Player " + playerId);
        doc.setSeason(SEASON);
        doc.setTeamAbbrev(team);
        doc.setGamesPlayed(gp);
        doc.setGoals(points / 2);
        doc.setAssists(points - points / 2);
        doc.setPoints(points);
        doc.setShots(gp * 2);
        return doc;
    }

    private static GameLogDocument logDoc(long playerId, long gameId, LocalDate date, String homeAway, int points) {
        GameLogDocument doc = new GameLogDocument();
        doc.setPlayerId(playerId);
        doc.setPlayerName("Player " + playerId);
        doc.setGameId(gameId);
        doc.setGameDate(date);
        doc.setSeason(SEASON);
        doc.setTeamAbbrev("TOR");
        doc.setOpponent("BOS");
        doc.setHomeAway(homeAway);
        doc.setGoals(0);
        doc.setAssists(points);
        doc.setPoints(points);
        doc.setShots(2);
        doc.setToi(17.5);
        return doc;
    }

    private static GoalieStatsDocument goalieDoc(long playerId, Double savePct) {
        GoalieStatsDocument doc = new GoalieStatsDocument();
        doc.setPlayerId(playerId);
        doc.setPlayerName("Goalie " + playerId);
        doc.setTeamAbbrev("BOS");
        doc.setSeason(SEASON);
        doc.setGamesStarted(20);
        doc.setSavePct(savePct);
        return doc;
    }

    private static ProbableGoalieDocument probable(long goalieId, boolean confirmed) {
        ProbableGoalieDocument doc = new ProbableGoalieDocument();
        doc.setGameId(1L);
        doc.setGameDate(DATE);
        doc.setTeamAbbrev("BOS");
        doc.setGoalieId(goalieId);
        doc.setConfirmed(confirmed);
        return doc;
    }

    @Nested
    @DisplayName("player records")
    class PlayerRecords {

        @Test
        void seasonRecord_isMapped() {
            when(seasonStats.findFirstByPlayerIdAndSeason(7L, SEASON)).thenReturn(Optional.of(seasonDoc(7, "TOR", 12, 13)));

            PlayerSeasonRecord record = repository.getSeasonRecord(7L, SEASON).orElseThrow();

            assertEquals(12, record.gamesPlayed());
            assertEquals(13, record.points());
            assertEquals("TOR", record.team());
        }

        @Test
        void seasonRecord_absentIsEmpty() {
            when(seasonStats.findFirstByPlayerIdAndSeason(7L, SEASON)).thenReturn(Optional.empty());
            assertTrue(repository.getSeasonRecord(7L, SEASON).isEmpty());
        }

        @Test
        void seasonRecord_negativeCountIsMalformed() {
            PlayerSeasonStatsDocument doc = seasonDoc(7, "TOR", 12, 13);
            doc.setPoints(-1);
            when(seasonStats.findFirstByPlayerIdAndSeason(7L, SEASON)).thenReturn(Optional.of(doc));

            assertThrows(StatisticsUnavailableException.class, () -> repository.getSeasonRecord(7L, SEASON));
        }

        @Test
        void recentGames_pointInTimeAndMostRecentFirst() {
            when(gameLogs.findByPlayerIdAndGameDateBeforeOrderByGameDateDescGameIdDesc(eq(7L), eq(DATE), any()))
                    .thenReturn(List.of(
                            logDoc(7, 10, DATE.minusDays(5), "away", 0),
                            logDoc(7, 12, DATE.minusDays(1), "home", 2),
                            logDoc(7, 11, DATE.minusDays(3), "HOME", 1)));

            List<GameLogEntry> recent = repository.getRecentGames(7L, 5, DATE);

            assertEquals(List.of(12L, 11L, 10L),
                    recent.stream().map(GameLogEntry::gameId).collect(Collectors.toList()));
            assertTrue(recent.get(0).home());
            assertTrue(recent.get(1).home());
            assertFalse(recent.get(2).home());
            verify(gameLogs).findByPlayerIdAndGameDateBeforeOrderByGameDateDescGameIdDesc(7L, DATE, PageRequest.of(0, 5));
        }

        @Test
        void recentGames_zeroLimitSkipsTheStore() {
            assertEquals(List.of(), repository.getRecentGames(7L, 0, DATE));
            verifyNoInteractions(gameLogs);
        }

        @Test
        void gameLog_unknownVenueIsMalformed() {
            when(gameLogs.findSeasonGames(7L, SEASON, DATE)).thenReturn(List.of(logDoc(7, 10, DATE.minusDays(2), "neutral", 1)));

            assertThrows(StatisticsUnavailableException.class, () -> repository.getSeasonGames(7L, SEASON, DATE));
        }

        @Test
        void gameLog_missingDateIsMalformed() {
            when(gameLogs.findHeadToHead(7L, "BOS", DATE)).thenReturn(List.of(logDoc(7, 10, null, "home", 1)));

            assertThrows(StatisticsUnavailableException.class, () -> repository.getHeadToHead(7L, "BOS", DATE));
        }

        @Test
        void headToHead_noMeetingsIsEmptyRecord() {
            when(gameLogs.findHeadToHead(7L, "BOS", DATE)).thenReturn(List.of());

            HeadToHeadRecord h2h = repository.getHeadToHead(7L, "BOS", DATE);

            assertEquals(0, h2h.sampleSize());
            assertEquals("BOS", h2h.opponent());
        }
    }

    @Nested
    @DisplayName("team and goalie context")
    class Contexts {

        @Test
        void teamContext_withoutRatesIsAbsent() {
            TeamSeasonStatsDocument doc = new TeamSeasonStatsDocument();
            doc.setTeamAbbrev("TOR");
            doc.setSeason(SEASON);
            doc.setGoalsForPerGame(3.2);
            when(teamStats.findFirstByTeamAbbrevAndSeason("TOR", SEASON)).thenReturn(Optional.of(doc));

            assertTrue(repository.getTeamContext("TOR", SEASON).isEmpty());
        }

        @Test
        void teamContext_isMapped() {
            TeamSeasonStatsDocument doc = new TeamSeasonStatsDocument();
            doc.setTeamAbbrev("TOR");
            doc.setSeason(SEASON);
            doc.setGoalsForPerGame(3.2);
            doc.setGoalsAgainstPerGame(2.8);
            when(teamStats.findFirstByTeamAbbrevAndSeason("TOR", SEASON)).thenReturn(Optional.of(doc));

            TeamContext context = repository.getTeamContext("TOR", SEASON).orElseThrow();
            assertEquals(3.2, context.goalsForPerGame());
            assertEquals(2.8, context.goalsAgainstPerGame());
        }

        @Test
        void goalie_noProbableStarterIsUnannounced() {
            when(goalieStats.findBySeasonAndGamesStartedGreaterThan(SEASON, 0))
                    .thenReturn(List.of(goalieDoc(2, 0.910), goalieDoc(1, 0.900)));
            when(probableGoalies.findByTeamAbbrevAndGameDate("BOS", DATE)).thenReturn(List.of());

            GoalieContext context = repository.getGoalieContext("BOS", DATE);

            assertFalse(context.isStarterAnnounced());
            assertEquals(0.905, context.leagueAverageSavePct(), 1e-12);
        }

        @Test
        void goalie_confirmedStarterWinsOverProjection() {
            when(probableGoalies.findByTeamAbbrevAndGameDate("BOS", DATE))
                    .thenReturn(List.of(probable(30L, false), probable(31L, true)));
            when(goalieStats.findFirstByPlayerIdAndSeason(31L, SEASON)).thenReturn(Optional.of(goalieDoc(31, 0.921)));

            GoalieContext context = repository.getGoalieContext("BOS", DATE);

            assertTrue(context.isStarterAnnounced());
            assertEquals(31L, context.goalieId());
            assertEquals(0.921, context.savePct());
            assertNull(context.leagueAverageSavePct());
        }

        @Test
        void goalie_withoutSeasonStatsIsNotUsable() {
            when(probableGoalies.findByTeamAbbrevAndGameDate("BOS", DATE)).thenReturn(List.of(probable(30L, true)));
            when(goalieStats.findFirstByPlayerIdAndSeason(30L, SEASON)).thenReturn(Optional.empty());

            GoalieContext context = repository.getGoalieContext("BOS", DATE);

            assertEquals(30L, context.goalieId());
            assertFalse(context.isStarterAnnounced());
        }

        @Test
        void goalie_impossibleSavePctIsMalformed() {
            when(probableGoalies.findByTeamAbbrevAndGameDate("BOS", DATE)).thenReturn(List.of(probable(30L, true)));
            when(goalieStats.findFirstByPlayerIdAndSeason(30L, SEASON)).thenReturn(Optional.of(goalieDoc(30, 91.2)));

            assertThrows(StatisticsUnavailableException.class, () -> repository.getGoalieContext("BOS", DATE));
        }
    }

    @Nested
    @DisplayName("schedule and rosters")
    class ScheduleAndRosters {

        @Test
        void schedule_derivesSeasonWhenMissing() {
            GameDocument doc = new GameDocument();
            doc.setGameId(2023020700L);
            doc.setGameDate(DATE);
            doc.setHomeTeamAbbrev("TOR");
            doc.setAwayTeamAbbrev("BOS");
            when(games.findByGameDateOrderByGameIdAsc(DATE)).thenReturn(List.of(doc));

            ScheduledGame game = repository.getScheduledGames(DATE).get(0);

            assertEquals(SEASON, game.season());
            assertTrue(game.isBetween("bos", "tor"));
        }

        @Test
        void schedule_missingTeamIsMalformed() {
            GameDocument doc = new GameDocument();
            doc.setGameId(1L);
            doc.setGameDate(DATE);
            doc.setHomeTeamAbbrev("TOR");
            when(games.findByGameDateOrderByGameIdAsc(DATE)).thenReturn(List.of(doc));

            assertThrows(StatisticsUnavailableException.class, () -> repository.getScheduledGames(DATE));
        }

        @Test
        void roster_mergesSeasonRecordsAndGameLogsByPlayerId() {
            when(seasonStats.findBySeasonAndTeamAbbrev(SEASON, "TOR"))
                    .thenReturn(List.of(seasonDoc(9, "TOR", 10, 5), seasonDoc(3, "TOR", 12, 8)));
            when(gameLogs.findPlayersBySeasonAndTeam(SEASON, "TOR"))
                    .thenReturn(List.of(logDoc(3, 1, DATE.minusDays(1), "home", 0), logDoc(5, 1, DATE.minusDays(1), "home", 0)));
            when(gameLogs.findFirstByPlayerIdAndSeasonOrderByGameDateDescGameIdDesc(5L, SEASON))
                    .thenReturn(Optional.of(logDoc(5, 1, DATE.minusDays(1), "home", 0)));

            List<RosterEntry> roster = repository.getRoster("TOR", SEASON);

            assertEquals(List.of(3L, 5L, 9L),
                    roster.stream().map(RosterEntry::playerId).collect(Collectors.toList()));
        }

        @Test
        void roster_tradedPlayerOnlyOnNewTeam() {
            when(seasonStats.findBySeasonAndTeamAbbrev(SEASON, "TOR")).thenReturn(List.of());
            when(seasonStats.findBySeasonAndTeamAbbrev(SEASON, "MTL")).thenReturn(List.of(seasonDoc(7, "MTL", 30, 18)));
            when(seasonStats.findFirstByPlayerIdAndSeason(7L, SEASON)).thenReturn(Optional.of(seasonDoc(7, "MTL", 30, 18)));
            when(gameLogs.findPlayersBySeasonAndTeam(SEASON, "TOR"))
                    .thenReturn(List.of(logDoc(7, 1, DATE.minusDays(60), "home", 1)));

            assertTrue(repository.getRoster("TOR", SEASON).isEmpty());
            assertEquals(List.of(new RosterEntry(7L, "Player 7", "MTL")), repository.getRoster("MTL", SEASON));
        }

        @Test
        void roster_logOnlyPlayerFollowsLatestGame() {
            GameLogDocument traded = logDoc(8, 2, DATE.minusDays(2), "away", 0);
            traded.setTeamAbbrev("MTL");
            when(gameLogs.findPlayersBySeasonAndTeam(SEASON, "TOR"))
                    .thenReturn(List.of(logDoc(8, 1, DATE.minusDays(20), "home", 0)));
            when(gameLogs.findFirstByPlayerIdAndSeasonOrderByGameDateDescGameIdDesc(8L, SEASON))
                    .thenReturn(Optional.of(traded));

            assertTrue(repository.getRoster("TOR", SEASON).isEmpty());
        }

        @Test
        void currentTeam_prefersSeasonRecord() {
            when(seasonStats.findFirstByPlayerIdAndSeason(7L, SEASON)).thenReturn(Optional.of(seasonDoc(7, "MTL", 30, 18)));

            assertEquals(Optional.of("MTL"), repository.getCurrentTeam(7L, SEASON));
            verify(gameLogs, never()).findFirstByPlayerIdAndSeasonOrderByGameDateDescGameIdDesc(anyLong(), anyString());
        }

        @Test
        void currentTeam_fallsBackToLatestGame() {
            when(gameLogs.findFirstByPlayerIdAndSeasonOrderByGameDateDescGameIdDesc(5L, SEASON))
                    .thenReturn(Optional.of(logDoc(5, 1, DATE.minusDays(1), "home", 0)));

            assertEquals(Optional.of("TOR"), repository.getCurrentTeam(5L, SEASON));
            assertTrue(repository.getCurrentTeam(6L, SEASON).isEmpty());
        }
    }

    @Test
    @DisplayName("store failures surface as StatisticsUnavailableException with the cause")
    void dataAccessFailure() {
        DataAccessResourceFailureException down = new DataAccessResourceFailureException("connection refused");
        when(seasonStats.findFirstByPlayerIdAndSeason(anyLong(), anyString())).thenThrow(down);

        StatisticsUnavailableException e = assertThrows(StatisticsUnavailableException.class,
                () -> repository.getSeasonRecord(7L, SEASON));
        assertSame(down, e.getCause());
    }
}
