package com.hockey.prediction.model;

import com.hockey.prediction.exception.InvalidScoringModelException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable calibration of the scoring ensemble: factor weights, normalization
 * ceilings and confidence thresholds.
 *
 * <p>Instances only exist in a validated state. Two runs holding different models never
 * share mutable state, so several calibrations can be evaluated side by side.
 */
public final class ScoringModel {

    public static final String DEFAULT_MODEL_ID = "default";

    // Parameter keys accepted by Builder.parameters(...)
    public static final String POINTS_PER_GAME_CEILING = "pointsPerGameCeiling";
    public static final String TEAM_PACE_CEILING = "teamPaceCeiling";
    public static final String SAVE_DIFFERENTIAL_SCALE = "saveDifferentialScale";
    public static final String HIGH_GAMES_PLAYED = "highGamesPlayed";
    public static final String MEDIUM_GAMES_PLAYED = "mediumGamesPlayed";
    public static final String MIN_GAMES_PLAYED = "minGamesPlayed";
    public static final String VARIANCE_THRESHOLD = "varianceThreshold";
    public static final String HEAD_TO_HEAD_MIN_GAMES = "headToHeadMinGames";
    public static final String VENUE_MIN_GAMES = "venueMinGames";
    public static final String LEAGUE_AVERAGE_SAVE_PCT = "leagueAverageSavePct";
    public static final String LEAGUE_AVERAGE_GOALS_PER_GAME = "leagueAverageGoalsPerGame";

    private final String modelId;
    private final Map<FactorName, Double> weights;
    private final double pointsPerGameCeiling;
    private final double teamPaceCeiling;
    private final double saveDifferentialScale;
    private final int highGamesPlayed;
    private final int mediumGamesPlayed;
    private final int minGamesPlayed;
    private final double varianceThreshold;
    private final int headToHeadMinGames;
    private final int venueMinGames;
    private final List<Double> recencyWeights;
    private final double leagueAverageSavePct;
    private final double leagueAverageGoalsPerGame;

    private ScoringModel(Builder b) {
        this.modelId = b.modelId;
        this.weights = Collections.unmodifiableMap(new EnumMap<>(b.weights));
        this.pointsPerGameCeiling = b.pointsPerGameCeiling;
        this.teamPaceCeiling = b.teamPaceCeiling;
        this.saveDifferentialScale = b.saveDifferentialScale;
        this.highGamesPlayed = b.highGamesPlayed;
        this.mediumGamesPlayed = b.mediumGamesPlayed;
        this.minGamesPlayed = b.minGamesPlayed;
        this.varianceThreshold = b.varianceThreshold;
        this.headToHeadMinGames = b.headToHeadMinGames;
        this.venueMinGames = b.venueMinGames;
        this.recencyWeights = List.copyOf(b.recencyWeights);
        this.leagueAverageSavePct = b.leagueAverageSavePct;
        this.leagueAverageGoalsPerGame = b.leagueAverageGoalsPerGame;
    }

    public static Builder builder(String modelId) {
        return new Builder(modelId);
    }

    /**
     * Builder pre-filled with this model's values, for deriving a variant.
     */
    public Builder toBuilder(String newModelId) {
        Builder b = new Builder(newModelId);
        b.weights.putAll(weights);
        b.pointsPerGameCeiling = pointsPerGameCeiling;
        b.teamPaceCeiling = teamPaceCeiling;
        b.saveDifferentialScale = saveDifferentialScale;
        b.highGamesPlayed = highGamesPlayed;
        b.mediumGamesPlayed = mediumGamesPlayed;
        b.minGamesPlayed = minGamesPlayed;
        b.varianceThreshold = varianceThreshold;
        b.headToHeadMinGames = headToHeadMinGames;
        b.venueMinGames = venueMinGames;
        b.recencyWeights = new ArrayList<>(recencyWeights);
        b.leagueAverageSavePct = leagueAverageSavePct;
        b.leagueAverageGoalsPerGame = leagueAverageGoalsPerGame;
        return b;
    }

    public String getModelId() { return modelId; }
    public Map<FactorName, Double> getWeights() { return weights; }
    public double weight(FactorName name) { return weights.get(name); }
    public double getPointsPerGameCeiling() { return pointsPerGameCeiling; }
    public double getTeamPaceCeiling() { return teamPaceCeiling; }
    public double getSaveDifferentialScale() { return saveDifferentialScale; }
    public int getHighGamesPlayed() { return highGamesPlayed; }
    public int getMediumGamesPlayed() { return mediumGamesPlayed; }
    public int getMinGamesPlayed() { return minGamesPlayed; }
    public double getVarianceThreshold() { return varianceThreshold; }
    public int getHeadToHeadMinGames() { return headToHeadMinGames; }
    public int getVenueMinGames() { return venueMinGames; }
    public List<Double> getRecencyWeights() { return recencyWeights; }
    public int getRecentFormWindow() { return recencyWeights.size(); }
    public double getLeagueAverageSavePct() { return leagueAverageSavePct; }
    public double getLeagueAverageGoalsPerGame() { return leagueAverageGoalsPerGame; }

    public static final class Builder {

        private final String modelId;
        private final Map<FactorName, Double> weights = new EnumMap<>(FactorName.class);
        private double pointsPerGameCeiling = 2.0;
        private double teamPaceCeiling = 8.0;
        private double saveDifferentialScale = 1.0;
        private int highGamesPlayed = 10;
        private int mediumGamesPlayed = 5;
        private int minGamesPlayed = 4;
        private double varianceThreshold = 1.0;
        private int headToHeadMinGames = 3;
        private int venueMinGames = 5;
        private List<Double> recencyWeights = new ArrayList<>(List.of(5.0, 4.0, 3.0, 2.0, 1.0));
        private double leagueAverageSavePct = 0.905;
        private double leagueAverageGoalsPerGame = 3.10;

        private Builder(String modelId) {
            this.modelId = modelId;
        }

        public Builder weight(FactorName name, double weight) {
            weights.put(name, weight);
            return this;
        }

        /**
         * Applies weights keyed by {@link FactorName#getKey()}. Unknown keys are rejected.
         */
        public Builder weights(Map<String, Double> byKey) {
            if (byKey == null) {
                return this;
            }
            byKey.forEach((key, value) -> {
                FactorName name = FactorName.fromKey(key)
                        .orElseThrow(() -> new InvalidScoringModelException(modelId, "unknown factor '" + key + "'"));
                if (value == null) {
                    throw new InvalidScoringModelException(modelId, "missing weight for " + key);
                }
                weights.put(name, value);
            });
            return this;
        }

        public Builder pointsPerGameCeiling(double v) { this.pointsPerGameCeiling = v; return this; }
        public Builder teamPaceCeiling(double v) { this.teamPaceCeiling = v; return this; }
        public Builder saveDifferentialScale(double v) { this.saveDifferentialScale = v; return this; }
        public Builder highGamesPlayed(int v) { this.highGamesPlayed = v; return this; }
        public Builder mediumGamesPlayed(int v) { this.mediumGamesPlayed = v; return this; }
        public Builder minGamesPlayed(int v) { this.minGamesPlayed = v; return this; }
        public Builder varianceThreshold(double v) { this.varianceThreshold = v; return this; }
        public Builder headToHeadMinGames(int v) { this.headToHeadMinGames = v; return this; }
        public Builder venueMinGames(int v) { this.venueMinGames = v; return this; }
        public Builder leagueAverageSavePct(double v) { this.leagueAverageSavePct = v; return this; }
        public Builder leagueAverageGoalsPerGame(double v) { this.leagueAverageGoalsPerGame = v; return this; }

        public Builder recencyWeights(List<Double> v) {
            this.recencyWeights = v == null ? new ArrayList<>() : new ArrayList<>(v);
            return this;
        }

        /**
         * Applies named parameter overrides as stored with a custom model.
         */
        public Builder parameters(Map<String, Object> parameters) {
            if (parameters == null) {
                return this;
            }
            for (Map.Entry<String, Object> entry : parameters.entrySet()) {
                if (!(entry.getValue() instanceof Number number)) {
                    throw new InvalidScoringModelException(modelId, "parameter '" + entry.getKey() + "' is not numeric");
                }
                switch (entry.getKey()) {
                    case POINTS_PER_GAME_CEILING -> pointsPerGameCeiling = number.doubleValue();
                    case TEAM_PACE_CEILING -> teamPaceCeiling = number.doubleValue();
                    case SAVE_DIFFERENTIAL_SCALE -> saveDifferentialScale = number.doubleValue();
                    case HIGH_GAMES_PLAYED -> highGamesPlayed = wholeNumber(entry.getKey(), number);
                    case MEDIUM_GAMES_PLAYED -> mediumGamesPlayed = wholeNumber(entry.getKey(), number);
                    case MIN_GAMES_PLAYED -> minGamesPlayed = wholeNumber(entry.getKey(), number);
                    case VARIANCE_THRESHOLD -> varianceThreshold = number.doubleValue();
                    case HEAD_TO_HEAD_MIN_GAMES -> headToHeadMinGames = wholeNumber(entry.getKey(), number);
                    case VENUE_MIN_GAMES -> venueMinGames = wholeNumber(entry.getKey(), number);
                    case LEAGUE_AVERAGE_SAVE_PCT -> leagueAverageSavePct = number.doubleValue();
                    case LEAGUE_AVERAGE_GOALS_PER_GAME -> leagueAverageGoalsPerGame = number.doubleValue();
                    default -> throw new InvalidScoringModelException(modelId, "unknown parameter '" + entry.getKey() + "'");
                }
            }
            return this;
        }

        private int wholeNumber(String key, Number number) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || value != Math.rint(value)
                    || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                fail("parameter '" + key + "' must be a whole number, was " + number);
            }
            return (int) value;
        }

        public ScoringModel build() {
            if (modelId == null || modelId.isBlank()) {
                throw new InvalidScoringModelException("Scoring model id is required");
            }
            for (FactorName name : FactorName.values()) {
                Double w = weights.get(name);
                if (w == null) {
                    fail("missing weight for " + name.getKey());
                }
                if (w.isNaN() || w < 0.0) {
                    fail("weight for " + name.getKey() + " must be >= 0, was " + w);
                }
            }
            // Summed in decimal so 0.30 + 0.25 + ... compares equal to exactly 1
            BigDecimal total = weights.values().stream()
                    .map(BigDecimal::valueOf)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (total.compareTo(BigDecimal.ONE) != 0) {
                fail("weights must sum to 1.0, sum was " + total.toPlainString());
            }
            requirePositive(POINTS_PER_GAME_CEILING, pointsPerGameCeiling);
            requirePositive(TEAM_PACE_CEILING, teamPaceCeiling);
            requirePositive(SAVE_DIFFERENTIAL_SCALE, saveDifferentialScale);
            requirePositive(LEAGUE_AVERAGE_GOALS_PER_GAME, leagueAverageGoalsPerGame);
            if (!(leagueAverageSavePct > 0.0 && leagueAverageSavePct < 1.0)) {
                fail(LEAGUE_AVERAGE_SAVE_PCT + " must be within (0,1)");
            }
            if (Double.isNaN(varianceThreshold) || varianceThreshold < 0.0) {
                fail(VARIANCE_THRESHOLD + " must be >= 0");
            }
            if (minGamesPlayed < 1 || mediumGamesPlayed < minGamesPlayed || highGamesPlayed < mediumGamesPlayed) {
                fail("games-played cutoffs must satisfy 1 <= min <= medium <= high");
            }
            if (headToHeadMinGames < 1 || venueMinGames < 1) {
                fail("head-to-head and venue sample cutoffs must be >= 1");
            }
            if (recencyWeights.isEmpty()) {
                fail("recency weights must not be empty");
            }
            for (Double w : recencyWeights) {
                if (w == null || w.isNaN() || w <= 0.0) {
                    fail("recency weights must all be > 0");
                }
            }
            return new ScoringModel(this);
        }

        private void requirePositive(String key, double value) {
            if (Double.isNaN(value) || value <= 0.0) {
                fail(key + " must be > 0, was " + value);
            }
        }

        private void fail(String problem) {
            throw new InvalidScoringModelException(modelId, problem);
        }
    }
}
