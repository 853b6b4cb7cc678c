package com.hockey.prediction.engine;

import com.hockey.prediction.engine.factor.FactorCalculator;
import com.hockey.prediction.engine.factor.FactorInputs;
import com.hockey.prediction.model.ConfidenceTier;
import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.PredictionResult;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scores one player for one game from an already loaded {@link FactorInputs} snapshot.
 * Pure: no repository access, no clock, no shared mutable state.
 */
@Component
public class PlayerPredictor {

    private static final Logger log = LoggerFactory.getLogger(PlayerPredictor.class);

    private final Map<FactorName, FactorCalculator> calculators;
    private final EnsembleAggregator aggregator;
    private final ConfidenceScorer confidenceScorer;

    public PlayerPredictor(List<FactorCalculator> calculators,
                           EnsembleAggregator aggregator,
                           ConfidenceScorer confidenceScorer) {
        Map<FactorName, FactorCalculator> byName = new EnumMap<>(FactorName.class);
        for (FactorCalculator calculator : calculators) {
            if (byName.put(calculator.name(), calculator) != null) {
                throw new IllegalStateException("Two calculators registered for " + calculator.name().getKey());
            }
        }
        for (FactorName name : FactorName.values()) {
            if (!byName.containsKey(name)) {
                throw new IllegalStateException("No calculator registered for " + name.getKey());
            }
        }
        this.calculators = Collections.unmodifiableMap(byName);
        this.aggregator = aggregator;
        this.confidenceScorer = confidenceScorer;
    }

    /**
     * @return the unranked prediction, or empty when the player has too little season
     *         history to be scored without biasing the slate
     */
    public Optional<PredictionResult> predict(FactorInputs inputs, ScoringModel model) {
        if (inputs.seasonRecord() == null) {
            log.debug("Excluding player {}: no season history", inputs.playerId());
            return Optional.empty();
        }
        if (inputs.gamesPlayed() < model.getMinGamesPlayed()) {
            log.debug("Excluding player {}: {} games played, {} required",
                    inputs.playerId(), inputs.gamesPlayed(), model.getMinGamesPlayed());
            return Optional.empty();
        }

        List<ScoringFactor> factors = new ArrayList<>(calculators.size());
        for (FactorCalculator calculator : calculators.values()) {
            factors.add(calculator.calculate(inputs, model));
        }
        double composite = aggregator.combine(factors);

        List<Integer> recentPoints = inputs.recentGames().stream()
                .limit(model.getRecentFormWindow())
                .map(GameLogEntry::points)
                .collect(Collectors.toList());
        ConfidenceTier confidence = confidenceScorer.score(
                new ConfidenceInputs(inputs.gamesPlayed(), recentPoints, inputs.headToHead().sampleSize()),
                model);

        String playerName = inputs.playerName() != null ? inputs.playerName() : inputs.seasonRecord().playerName();
        return Optional.of(new PredictionResult(
                inputs.playerId(),
                playerName,
                inputs.team(),
                inputs.opponent(),
                inputs.home(),
                inputs.game().gameId(),
                inputs.game().gameDate(),
                composite,
                confidence,
                factors,
                Highlights.describe(inputs, confidence, model),
                0
        ));
    }
}
