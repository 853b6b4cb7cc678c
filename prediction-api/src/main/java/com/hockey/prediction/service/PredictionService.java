package com.hockey.prediction.service;

import com.hockey.prediction.engine.SlateRanker;
import com.hockey.prediction.exception.ResourceNotFoundException;
import com.hockey.prediction.model.PredictionResult;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.ScheduledGame;
import com.hockey.prediction.stats.Seasons;
import com.hockey.prediction.stats.StatisticsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Service for ranking the players most likely to score on a date.
 *
 * <p>A missing date means today in UTC; a missing model id means the active model.
 * Every call runs a fresh ranking against the current statistics.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final SlateRanker slateRanker;
    private final ModelService modelService;
    private final StatisticsRepository statistics;
    private final Clock clock;

    public PredictionService(SlateRanker slateRanker,
                             ModelService modelService,
                             StatisticsRepository statistics,
                             Clock clock) {
        this.slateRanker = slateRanker;
        this.modelService = modelService;
        this.statistics = statistics;
        this.clock = clock;
    }

    /**
     * Ranked predictions for every game on the date.
     */
    public List<PredictionResult> predictSlate(LocalDate date, String modelId, Integer limit) {
        ScoringModel model = modelService.resolve(modelId);
        List<PredictionResult> ranked = slateRanker.rankSlate(dateOrToday(date), model);
        return truncate(ranked, limit);
    }

    /**
     * Ranked predictions for the game between two teams on the date.
     *
     * @throws ResourceNotFoundException if the teams do not meet that day
     */
    public List<PredictionResult> predictMatchup(String teamA, String teamB, LocalDate date,
                                                 String modelId, Integer limit) {
        LocalDate day = dateOrToday(date);
        String a = normalizeTeam(teamA);
        String b = normalizeTeam(teamB);
        if (a.equals(b)) {
            throw new IllegalArgumentException("A matchup needs two different teams");
        }
        ScoringModel model = modelService.resolve(modelId);

        boolean scheduled = statistics.getScheduledGames(day).stream().anyMatch(g -> g.isBetween(a, b));
        if (!scheduled) {
            throw new ResourceNotFoundException("No game between " + a + " and " + b + " on " + day);
        }
        return truncate(slateRanker.rankMatchup(a, b, day, model), limit);
    }

    /**
     * One player's prediction, ranked within their own game.
     *
     * @throws ResourceNotFoundException if the player has no game that day or too little
     *         history to be ranked
     */
    public PredictionResult predictPlayer(long playerId, LocalDate date, String modelId) {
        LocalDate day = dateOrToday(date);
        ScoringModel model = modelService.resolve(modelId);

        String team = statistics.getCurrentTeam(playerId, Seasons.forDate(day))
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));

        ScheduledGame game = statistics.getScheduledGames(day).stream()
                .filter(g -> g.involves(team))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No game for player " + playerId + " (" + team + ") on " + day));

        return slateRanker.rankGames(List.of(game), model).stream()
                .filter(p -> p.playerId() == playerId)
                .findFirst()
                .orElseThrow(() -> {
                    log.debug("Player {} has no ranked prediction for game {}", playerId, game.gameId());
                    return new ResourceNotFoundException(
                            "Player " + playerId + " has too little history for a prediction");
                });
    }

    private LocalDate dateOrToday(LocalDate date) {
        return date != null ? date : LocalDate.now(clock);
    }

    private static String normalizeTeam(String team) {
        if (team == null || team.isBlank()) {
            throw new IllegalArgumentException("Team abbreviation is required");
        }
        return team.trim().toUpperCase(Locale.ROOT);
    }

    private static List<PredictionResult> truncate(List<PredictionResult> ranked, Integer limit) {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        if (limit == null || limit >= ranked.size()) {
            return ranked;
        }
        return List.copyOf(ranked.subList(0, limit));
    }
}
