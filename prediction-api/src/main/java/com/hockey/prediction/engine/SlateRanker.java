package com.hockey.prediction.engine;

import com.hockey.prediction.engine.factor.FactorInputs;
import com.hockey.prediction.exception.PredictionRunAbortedException;
import com.hockey.prediction.model.PredictionResult;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.RosterEntry;
import com.hockey.prediction.stats.ScheduledGame;
import com.hockey.prediction.stats.StatisticsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Ranks every eligible player of a set of games.
 *
 * <p>Players are scored in parallel on the slate pool. A run either returns the complete
 * ranking or fails as a whole: the first failing task aborts the run, players not yet
 * started are skipped and already computed results are discarded.
 *
 * <p>Tasks waiting for a slate thread never exceed the pool's queue capacity, across all
 * concurrent runs, so a slate of any size is submitted without overflowing the queue.
 */
@Component
public class SlateRanker {

    private static final Logger log = LoggerFactory.getLogger(SlateRanker.class);

    /**
     * Composite descending, then confidence descending, then player id ascending.
     */
    public static final Comparator<PredictionResult> SLATE_ORDER =
            Comparator.comparingDouble(PredictionResult::compositeScore).reversed()
                    .thenComparing(PredictionResult::confidence, Comparator.reverseOrder())
                    .thenComparingLong(PredictionResult::playerId);

    private final StatisticsRepository statistics;
    private final PlayerInputLoader inputLoader;
    private final PlayerPredictor predictor;
    private final ExecutorService slateExecutor;
    private final Semaphore queueSlots;

    public SlateRanker(StatisticsRepository statistics,
                       PlayerInputLoader inputLoader,
                       PlayerPredictor predictor,
                       @Qualifier("slateExecutor") ExecutorService slateExecutor,
                       @Value("${hockey.prediction.workers.queue-capacity:1024}") int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Slate queue capacity must be positive, was " + queueCapacity);
        }
        this.statistics = statistics;
        this.inputLoader = inputLoader;
        this.predictor = predictor;
        this.slateExecutor = slateExecutor;
        this.queueSlots = new Semaphore(queueCapacity, true);
    }

    public List<PredictionResult> rankSlate(LocalDate date, ScoringModel model) {
        List<ScheduledGame> games = statistics.getScheduledGames(date);
        log.info("Ranking slate for {} with model '{}': {} games", date, model.getModelId(), games.size());
        return rankGames(games, model);
    }

    public List<PredictionResult> rankMatchup(String teamA, String teamB, LocalDate date, ScoringModel model) {
        List<ScheduledGame> games = statistics.getScheduledGames(date).stream()
                .filter(game -> game.isBetween(teamA, teamB))
                .collect(Collectors.toList());
        log.info("Ranking matchup {} vs {} on {} with model '{}': {} games",
                teamA, teamB, date, model.getModelId(), games.size());
        return rankGames(games, model);
    }

    public List<PredictionResult> rankGames(List<ScheduledGame> games, ScoringModel model) {
        if (games.isEmpty()) {
            return List.of();
        }
        AtomicBoolean aborted = new AtomicBoolean(false);

        List<Callable<MatchupContext>> matchupTasks = games.stream()
                .sorted(Comparator.comparingLong(ScheduledGame::gameId))
                .map(game -> guarded(aborted, () -> inputLoader.loadMatchup(game)))
                .collect(Collectors.toList());
        List<MatchupContext> matchups = runAll(matchupTasks, aborted);
        matchups.sort(Comparator.comparingLong(m -> m.game().gameId()));

        // A player listed in two games keeps the one with the lowest game id.
        Map<Long, Callable<Optional<PredictionResult>>> playerTasks = new LinkedHashMap<>();
        for (MatchupContext matchup : matchups) {
            List<RosterEntry> players = new ArrayList<>(matchup.homeRoster());
            players.addAll(matchup.awayRoster());
            for (RosterEntry player : players) {
                playerTasks.putIfAbsent(player.playerId(), guarded(aborted, () -> {
                    FactorInputs inputs = inputLoader.loadPlayer(player, matchup, model);
                    return predictor.predict(inputs, model);
                }));
            }
        }

        List<Optional<PredictionResult>> predictions = runAll(new ArrayList<>(playerTasks.values()), aborted);
        List<PredictionResult> scored = predictions.stream()
                .flatMap(Optional::stream)
                .sorted(SLATE_ORDER)
                .collect(Collectors.toList());

        List<PredictionResult> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            ranked.add(scored.get(i).withRank(i + 1));
        }
        log.info("Ranked {} of {} players across {} games", ranked.size(), playerTasks.size(), matchups.size());
        return ranked;
    }

    /**
     * Skips the work once the run is aborted and aborts the run when the work fails.
     */
    private static <T> Callable<T> guarded(AtomicBoolean aborted, Callable<T> work) {
        return () -> {
            if (aborted.get()) {
                // discarded; the task that aborted the run reports the failure
                return null;
            }
            try {
                return work.call();
            } catch (RuntimeException | Error e) {
                aborted.set(true);
                throw e;
            }
        };
    }

    private <T> List<T> runAll(List<Callable<T>> tasks, AtomicBoolean aborted) {
        ExecutorCompletionService<T> completion = new ExecutorCompletionService<>(slateExecutor);
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        List<T> results = new ArrayList<>(tasks.size());
        try {
            for (Callable<T> task : tasks) {
                if (aborted.get()) {
                    break;
                }
                futures.add(submit(completion, task));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(completion.take().get());
            }
            if (results.size() < tasks.size()) {
                throw new PredictionRunAbortedException("Prediction run stopped before all tasks were submitted");
            }
            return results;
        } catch (ExecutionException e) {
            aborted.set(true);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                log.warn("Prediction run failed: {}", runtime.getMessage());
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PredictionRunAbortedException("Prediction task failed", cause);
        } catch (InterruptedException e) {
            aborted.set(true);
            Thread.currentThread().interrupt();
            throw new PredictionRunAbortedException("Prediction run interrupted", e);
        } catch (RejectedExecutionException e) {
            aborted.set(true);
            log.warn("Slate pool rejected a prediction task: {}", e.getMessage());
            throw new PredictionRunAbortedException("Slate pool rejected a prediction task", e);
        }
    }

    /**
     * Waits for a free queue slot, then submits. The slot is freed when the task ends.
     * Submitted tasks are not cancelled, so every slot is eventually returned.
     */
    private <T> Future<T> submit(ExecutorCompletionService<T> completion, Callable<T> task)
            throws InterruptedException {
        queueSlots.acquire();
        try {
            return completion.submit(() -> {
                try {
                    return task.call();
                } finally {
                    queueSlots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            queueSlots.release();
            throw e;
        }
    }
}
