package com.hockey.prediction.engine;

import com.hockey.prediction.engine.factor.FactorInputs;
import com.hockey.prediction.exception.StatisticsUnavailableException;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import com.hockey.prediction.stats.GoalieContext;
import com.hockey.prediction.stats.HeadToHeadRecord;
import com.hockey.prediction.stats.RosterEntry;
import com.hockey.prediction.stats.ScheduledGame;
import com.hockey.prediction.stats.StatisticsRepository;
import com.hockey.prediction.stats.TeamContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.hockey.prediction.engine.factor.FactorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PlayerInputLoaderTest {

    private final ScoringModel model = defaultModel();
    private final ScheduledGame game = game(1L, "TOR", "BOS");
    private final TeamContext tor = new TeamContext("TOR", SEASON, 3.4, 2.7);
    private final TeamContext bos = new TeamContext("BOS", SEASON, 3.0, 3.1);
    private final GoalieContext torGoalie = goalie("TOR", 0.912, 0.905);
    private final GoalieContext bosGoalie = goalie("BOS", 0.899, 0.905);

    StatisticsRepository statistics;
    ExecutorService readExecutor;
    PlayerInputLoader loader;

    @BeforeEach
    void setUp() {
        statistics = mock(StatisticsRepository.class);
        readExecutor = Executors.newFixedThreadPool(4);
        loader = new PlayerInputLoader(statistics, readExecutor);

        when(statistics.getTeamContext("TOR", SEASON)).thenReturn(Optional.of(tor));
        when(statistics.getTeamContext("BOS", SEASON)).thenReturn(Optional.empty());
        when(statistics.getGoalieContext("TOR", GAME_DATE)).thenReturn(torGoalie);
        when(statistics.getGoalieContext("BOS", GAME_DATE)).thenReturn(bosGoalie);
        when(statistics.getRoster("TOR", SEASON)).thenReturn(List.of(new RosterEntry(1L, "Home Skater", "TOR")));
        when(statistics.getRoster("BOS", SEASON)).thenReturn(List.of(new RosterEntry(2L, "Away Skater", "BOS")));
        when(statistics.getHeadToHead(anyLong(), anyString(), eq(GAME_DATE)))
                .thenAnswer(inv -> HeadToHeadRecord.empty(inv.getArgument(0, Long.class), inv.getArgument(1, String.class)));
    }

    @AfterEach
    void tearDown() {
        readExecutor.shutdownNow();
    }

    @Test
    void loadMatchup_collectsBothSides() {
        MatchupContext matchup = loader.loadMatchup(game);

        assertEquals(tor, matchup.homeTeam());
        assertNull(matchup.awayTeam());
        assertEquals(torGoalie, matchup.homeGoalie());
        assertEquals(bosGoalie, matchup.awayGoalie());
        assertEquals(1, matchup.homeRoster().size());
        assertEquals(2L, matchup.awayRoster().get(0).playerId());
    }

    @Test
    void loadPlayer_awaySkaterFacesHomeGoalie() {
        when(statistics.getSeasonRecord(2L, SEASON)).thenReturn(Optional.of(seasonRecord(2L, 15, 12)));
        MatchupContext matchup = new MatchupContext(game, tor, bos, torGoalie, bosGoalie, List.of(), List.of());

        FactorInputs inputs = loader.loadPlayer(new RosterEntry(2L, "Away Skater", "BOS"), matchup, model);

        assertFalse(inputs.home());
        assertEquals("TOR", inputs.opponent());
        assertEquals(torGoalie, inputs.opposingGoalie());
        assertEquals(bos, inputs.ownTeam());
        assertEquals(tor, inputs.opponentTeam());
        assertEquals(15, inputs.gamesPlayed());
        verify(statistics).getRecentGames(2L, 5, GAME_DATE);
        verify(statistics).getHeadToHead(2L, "TOR", GAME_DATE);
    }

    @Test
    void loadPlayer_aggregatesSeasonFromGameLogWhenRecordMissing() {
        List<GameLogEntry> games = pointsSequence(1L, 1, 0, 2, 1);
        when(statistics.getSeasonRecord(1L, SEASON)).thenReturn(Optional.empty());
        when(statistics.getSeasonGames(1L, SEASON, GAME_DATE)).thenReturn(games);
        MatchupContext matchup = new MatchupContext(game, tor, bos, torGoalie, bosGoalie, List.of(), List.of());

        FactorInputs inputs = loader.loadPlayer(new RosterEntry(1L, "Home Skater", "TOR"), matchup, model);

        assertNotNull(inputs.seasonRecord());
        assertEquals(4, inputs.gamesPlayed());
        assertEquals(1.0, inputs.seasonPointsPerGame());
        assertEquals("TOR", inputs.seasonRecord().team());
        assertEquals(bosGoalie, inputs.opposingGoalie());
    }

    @Test
    void loadPlayer_noHistoryLeavesRecordEmpty() {
        when(statistics.getSeasonRecord(1L, SEASON)).thenReturn(Optional.empty());
        MatchupContext matchup = new MatchupContext(game, tor, bos, torGoalie, bosGoalie, List.of(), List.of());

        FactorInputs inputs = loader.loadPlayer(new RosterEntry(1L, "Home Skater", "TOR"), matchup, model);

        assertNull(inputs.seasonRecord());
        assertEquals(0, inputs.gamesPlayed());
    }

    @Test
    void repositoryFailure_isRethrownUnwrapped() {
        when(statistics.getRoster("BOS", SEASON)).thenThrow(new StatisticsUnavailableException("roster read failed"));

        StatisticsUnavailableException e = assertThrows(StatisticsUnavailableException.class,
                () -> loader.loadMatchup(game));
        assertEquals("roster read failed", e.getMessage());
    }
}
