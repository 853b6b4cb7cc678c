package com.hockey.prediction.engine;

import com.hockey.prediction.engine.factor.FactorInputs;
import com.hockey.prediction.exception.StatisticsUnavailableException;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import com.hockey.prediction.stats.GoalieContext;
import com.hockey.prediction.stats.HeadToHeadRecord;
import com.hockey.prediction.stats.PlayerSeasonRecord;
import com.hockey.prediction.stats.RosterEntry;
import com.hockey.prediction.stats.ScheduledGame;
import com.hockey.prediction.stats.StatisticsRepository;
import com.hockey.prediction.stats.TeamContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Reads the statistics a prediction needs. Independent queries for the same game or
 * player are issued concurrently on the statistics read pool.
 */
@Component
public class PlayerInputLoader {

    private final StatisticsRepository statistics;
    private final ExecutorService readExecutor;

    public PlayerInputLoader(StatisticsRepository statistics,
                             @Qualifier("statsReadExecutor") ExecutorService readExecutor) {
        this.statistics = statistics;
        this.readExecutor = readExecutor;
    }

    public MatchupContext loadMatchup(ScheduledGame game) {
        String home = game.homeTeam();
        String away = game.awayTeam();
        String season = game.season();

        CompletableFuture<Optional<TeamContext>> homeTeam = async(() -> statistics.getTeamContext(home, season));
        CompletableFuture<Optional<TeamContext>> awayTeam = async(() -> statistics.getTeamContext(away, season));
        CompletableFuture<GoalieContext> homeGoalie = async(() -> statistics.getGoalieContext(home, game.gameDate()));
        CompletableFuture<GoalieContext> awayGoalie = async(() -> statistics.getGoalieContext(away, game.gameDate()));
        CompletableFuture<List<RosterEntry>> homeRoster = async(() -> statistics.getRoster(home, season));
        CompletableFuture<List<RosterEntry>> awayRoster = async(() -> statistics.getRoster(away, season));

        return new MatchupContext(
                game,
                await(homeTeam).orElse(null),
                await(awayTeam).orElse(null),
                await(homeGoalie),
                await(awayGoalie),
                await(homeRoster),
                await(awayRoster)
        );
    }

    public FactorInputs loadPlayer(RosterEntry player, MatchupContext matchup, ScoringModel model) {
        ScheduledGame game = matchup.game();
        boolean home = matchup.isHomeTeam(player.team());
        String opponent = home ? game.awayTeam() : game.homeTeam();
        long playerId = player.playerId();

        CompletableFuture<Optional<PlayerSeasonRecord>> season =
                async(() -> statistics.getSeasonRecord(playerId, game.season()));
        CompletableFuture<List<GameLogEntry>> recent =
                async(() -> statistics.getRecentGames(playerId, model.getRecentFormWindow(), game.gameDate()));
        CompletableFuture<List<GameLogEntry>> seasonGames =
                async(() -> statistics.getSeasonGames(playerId, game.season(), game.gameDate()));
        CompletableFuture<HeadToHeadRecord> headToHead =
                async(() -> statistics.getHeadToHead(playerId, opponent, game.gameDate()));

        List<GameLogEntry> played = await(seasonGames);
        PlayerSeasonRecord record = await(season)
                .orElseGet(() -> played.isEmpty()
                        ? null
                        : PlayerSeasonRecord.fromGameLog(playerId, player.playerName(), game.season(),
                                player.team(), played));

        return new FactorInputs(
                playerId,
                player.playerName(),
                player.team(),
                opponent,
                home,
                game,
                record,
                await(recent),
                played,
                await(headToHead),
                home ? matchup.homeTeam() : matchup.awayTeam(),
                home ? matchup.awayTeam() : matchup.homeTeam(),
                home ? matchup.awayGoalie() : matchup.homeGoalie()
        );
    }

    private <T> CompletableFuture<T> async(Supplier<T> query) {
        return CompletableFuture.supplyAsync(query, readExecutor);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new StatisticsUnavailableException("Statistics read failed", cause);
        }
    }
}
