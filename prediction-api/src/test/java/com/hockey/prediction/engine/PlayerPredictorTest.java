package com.hockey.prediction.engine;

import com.hockey.prediction.engine.factor.FactorCalculator;
import com.hockey.prediction.engine.factor.FactorInputs;
import com.hockey.prediction.engine.factor.GoalieMatchupCalculator;
import com.hockey.prediction.engine.factor.HeadToHeadCalculator;
import com.hockey.prediction.engine.factor.HomeAwaySplitCalculator;
import com.hockey.prediction.engine.factor.RecentFormCalculator;
import com.hockey.prediction.engine.factor.SeasonBaselineCalculator;
import com.hockey.prediction.engine.factor.TeamPaceCalculator;
import com.hockey.prediction.model.ConfidenceTier;
import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.PredictionResult;
import com.hockey.prediction.model.ScoringFactor;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import com.hockey.prediction.stats.GoalieContext;
import com.hockey.prediction.stats.TeamContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.hockey.prediction.engine.factor.FactorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PlayerPredictorTest {

    private final ScoringModel model = defaultModel();
    private final PlayerPredictor predictor = new PlayerPredictor(
            allCalculators(), new EnsembleAggregator(), new ConfidenceScorer());

    static List<FactorCalculator> allCalculators() {
        return List.of(new TeamPaceCalculator(), new GoalieMatchupCalculator(), new HomeAwaySplitCalculator(),
                new HeadToHeadCalculator(), new SeasonBaselineCalculator(), new RecentFormCalculator());
    }

    /**
     * 12 GP, 8 points over the last five, four meetings at 1.5 PPG, home game,
     * opposing starter 2% below league average, fast-paced matchup.
     */
    private FactorInputs strongHomeScorer() {
        List<GameLogEntry> seasonGames = new ArrayList<>();
        int[] homePoints = {2, 2, 1, 1, 1, 0};
        int[] awayPoints = {2, 1, 1, 1, 0, 1};
        for (int i = 0; i < 6; i++) {
            seasonGames.add(played(7, 2 * i + 1, "MTL", true, homePoints[i]));
            seasonGames.add(played(7, 2 * i + 2, "MTL", false, awayPoints[i]));
        }
        List<GameLogEntry> meetings = List.of(
                played(7, 30, "BOS", true, 2),
                played(7, 60, "BOS", false, 1),
                played(7, 300, "BOS", true, 2),
                played(7, 400, "BOS", false, 1));
        return inputs(7)
                .season(12, 13)
                .recentGames(pointsSequence(7, 2, 2, 2, 1, 1))
                .seasonGames(seasonGames)
                .headToHead(meetings)
                .ownTeam(new TeamContext("TOR", SEASON, 3.6, 2.8))
                .opponentTeam(new TeamContext("BOS", SEASON, 2.9, 3.4))
                .opposingGoalie(goalie("BOS", 0.885, 0.905))
                .build();
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("strong home scorer → HIGH confidence, composite above 0.6")
        void strongScorer() {
            PredictionResult result = predictor.predict(strongHomeScorer(), model).orElseThrow();

            assertEquals(ConfidenceTier.HIGH, result.confidence());
            assertTrue(result.compositeScore() > 0.6, "composite " + result.compositeScore());
            assertEquals(7L, result.playerId());
            assertEquals("BOS", result.opponent());
            assertTrue(result.home());
            assertEquals(0, result.rank());
        }

        @Test
        @DisplayName("3 games played → excluded")
        void tooFewGames() {
            FactorInputs inputs = inputs(9).season(3, 6).recentGames(pointsSequence(9, 2, 2, 2)).build();
            assertEquals(Optional.empty(), predictor.predict(inputs, model));
        }

        @Test
        @DisplayName("no season history → excluded")
        void noHistory() {
            FactorInputs inputs = inputs(9).seasonRecord(null).build();
            assertTrue(predictor.predict(inputs, model).isEmpty());
        }

        @Test
        @DisplayName("4 games played → ranked with LOW confidence")
        void lowConfidence() {
            FactorInputs inputs = inputs(9).season(4, 4).recentGames(pointsSequence(9, 1, 1, 1, 1)).build();
            PredictionResult result = predictor.predict(inputs, model).orElseThrow();

            assertEquals(ConfidenceTier.LOW, result.confidence());
            assertTrue(result.highlights().contains("Limited data - prediction less reliable"));
        }

        @Test
        @DisplayName("no announced starter → goalie factor 0.5 with fallback, composite still computed")
        void unannouncedGoalie() {
            FactorInputs announced = strongHomeScorer();
            FactorInputs unannounced = new FactorInputs(announced.playerId(), announced.playerName(),
                    announced.team(), announced.opponent(), announced.home(), announced.game(),
                    announced.seasonRecord(), announced.recentGames(), announced.seasonGames(),
                    announced.headToHead(), announced.ownTeam(), announced.opponentTeam(),
                    GoalieContext.unannounced("BOS", 0.905));

            PredictionResult withGoalie = predictor.predict(announced, model).orElseThrow();
            PredictionResult result = predictor.predict(unannounced, model).orElseThrow();

            ScoringFactor goalie = result.factor(FactorName.GOALIE_MATCHUP);
            assertEquals(0.5, goalie.score());
            assertTrue(goalie.isFallbackUsed());
            // goalie factor moved from 1.0 to 0.5 at weight 0.10
            assertEquals(withGoalie.compositeScore() - 0.05, result.compositeScore(), 1e-12);
            assertTrue(result.highlights().contains("Opposing starter not announced"));
        }
    }

    @Test
    @DisplayName("composite is recomputable from the stored factors")
    void compositeRecomputable() {
        PredictionResult result = predictor.predict(strongHomeScorer(), model).orElseThrow();

        BigDecimal sum = result.factors().stream()
                .map(ScoringFactor::contribution)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(sum.doubleValue(), result.compositeScore());
    }

    @Test
    @DisplayName("six factors in declaration order, whatever order the calculators were registered in")
    void factorOrder() {
        PredictionResult result = predictor.predict(strongHomeScorer(), model).orElseThrow();

        List<FactorName> names = result.factors().stream().map(ScoringFactor::name).collect(Collectors.toList());
        assertEquals(List.of(FactorName.values()), names);
    }

    @Test
    @DisplayName("highlights describe the matchup")
    void highlights() {
        List<String> highlights = predictor.predict(strongHomeScorer(), model).orElseThrow().highlights();

        assertTrue(highlights.contains("Hot streak: 1.60 PPG in last 5 games"), highlights.toString());
        assertTrue(highlights.contains("Strong history vs BOS: 1.50 PPG in 4 games"), highlights.toString());
        assertTrue(highlights.contains("Favorable goalie matchup: Goalie BOS (0.885 SV%)"), highlights.toString());
        assertTrue(highlights.contains("High-scoring environment: 7.0 combined goals per game"), highlights.toString());
    }

    @Test
    @DisplayName("alternative model changes the composite, not the inputs")
    void alternativeModel() {
        ScoringModel formHeavy = ScoringModel.builder("form-heavy")
                .weight(FactorName.RECENT_FORM, 0.50)
                .weight(FactorName.SEASON_BASELINE, 0.10)
                .weight(FactorName.HEAD_TO_HEAD, 0.10)
                .weight(FactorName.HOME_AWAY, 0.10)
                .weight(FactorName.GOALIE_MATCHUP, 0.10)
                .weight(FactorName.TEAM_PACE, 0.10)
                .build();
        FactorInputs inputs = strongHomeScorer();

        double baseline = predictor.predict(inputs, model).orElseThrow().compositeScore();
        double alternative = predictor.predict(inputs, formHeavy).orElseThrow().compositeScore();

        assertNotEquals(baseline, alternative);
        assertEquals(baseline, predictor.predict(inputs, model).orElseThrow().compositeScore());
    }

    @Test
    @DisplayName("a missing calculator is a wiring error")
    void missingCalculator() {
        List<FactorCalculator> five = new ArrayList<>(allCalculators());
        five.remove(0);
        assertThrows(IllegalStateException.class,
                () -> new PlayerPredictor(five, new EnsembleAggregator(), new ConfidenceScorer()));
    }
}
