package com.hockey.prediction.config;

import com.hockey.prediction.model.ScoringModel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "hockey.prediction")
public class PredictionProperties {

    /**
     * Factor weights keyed by factor name (recentForm, seasonBaseline, ...).
     */
    private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
            "recentForm", 0.30,
            "seasonBaseline", 0.25,
            "headToHead", 0.15,
            "homeAway", 0.10,
            "goalieMatchup", 0.10,
            "teamPace", 0.10
    ));
    private Ceilings ceilings = new Ceilings();
    private Confidence confidence = new Confidence();
    private int minGamesPlayed = 4;
    private int venueMinGames = 5;
    private List<Double> recencyWeights = new ArrayList<>(List.of(5.0, 4.0, 3.0, 2.0, 1.0));
    private League league = new League();
    private Workers workers = new Workers();

    /**
     * Builds the built-in model. Throws if the configured values are unusable.
     */
    public ScoringModel toScoringModel() {
        return ScoringModel.builder(ScoringModel.DEFAULT_MODEL_ID)
                .weights(weights)
                .pointsPerGameCeiling(ceilings.getPointsPerGame())
                .teamPaceCeiling(ceilings.getTeamPace())
                .saveDifferentialScale(ceilings.getSaveDifferential())
                .highGamesPlayed(confidence.getHighGamesPlayed())
                .mediumGamesPlayed(confidence.getMediumGamesPlayed())
                .varianceThreshold(confidence.getVarianceThreshold())
                .headToHeadMinGames(confidence.getHeadToHeadMinGames())
                .minGamesPlayed(minGamesPlayed)
                .venueMinGames(venueMinGames)
                .recencyWeights(recencyWeights)
                .leagueAverageSavePct(league.getAverageSavePct())
                .leagueAverageGoalsPerGame(league.getAverageGoalsPerGame())
                .build();
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public Ceilings getCeilings() {
        return ceilings;
    }

    public void setCeilings(Ceilings ceilings) {
        this.ceilings = ceilings;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public void setConfidence(Confidence confidence) {
        this.confidence = confidence;
    }

    public int getMinGamesPlayed() {
        return minGamesPlayed;
    }

    public void setMinGamesPlayed(int minGamesPlayed) {
        this.minGamesPlayed = minGamesPlayed;
    }

    public int getVenueMinGames() {
        return venueMinGames;
    }

    public void setVenueMinGames(int venueMinGames) {
        this.venueMinGames = venueMinGames;
    }

    public List<Double> getRecencyWeights() {
        return recencyWeights;
    }

    public void setRecencyWeights(List<Double> recencyWeights) {
        this.recencyWeights = recencyWeights;
    }

    public League getLeague() {
        return league;
    }

    public void setLeague(League league) {
        this.league = league;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public static class Ceilings {

        private double pointsPerGame = 2.0;
        private double teamPace = 8.0;
        private double saveDifferential = 1.0;

        public double getPointsPerGame() {
            return pointsPerGame;
        }

        public void setPointsPerGame(double pointsPerGame) {
            this.pointsPerGame = pointsPerGame;
        }

        public double getTeamPace() {
            return teamPace;
        }

        public void setTeamPace(double teamPace) {
            this.teamPace = teamPace;
        }

        public double getSaveDifferential() {
            return saveDifferential;
        }

        public void setSaveDifferential(double saveDifferential) {
            this.saveDifferential = saveDifferential;
        }
    }

    public static class Confidence {

        private int highGamesPlayed = 10;
        private int mediumGamesPlayed = 5;
        private double varianceThreshold = 1.0;
        private int headToHeadMinGames = 3;

        public int getHighGamesPlayed() {
            return highGamesPlayed;
        }

        public void setHighGamesPlayed(int highGamesPlayed) {
            this.highGamesPlayed = highGamesPlayed;
        }

        public int getMediumGamesPlayed() {
            return mediumGamesPlayed;
        }

        public void setMediumGamesPlayed(int mediumGamesPlayed) {
            this.mediumGamesPlayed = mediumGamesPlayed;
        }

        public double getVarianceThreshold() {
            return varianceThreshold;
        }

        public void setVarianceThreshold(double varianceThreshold) {
            this.varianceThreshold = varianceThreshold;
        }

        public int getHeadToHeadMinGames() {
            return headToHeadMinGames;
        }

        public void setHeadToHeadMinGames(int headToHeadMinGames) {
            this.headToHeadMinGames = headToHeadMinGames;
        }
    }

    public static class League {

        private double averageSavePct = 0.905;
        private double averageGoalsPerGame = 3.10;

        public double getAverageSavePct() {
            return averageSavePct;
        }

        public void setAverageSavePct(double averageSavePct) {
            this.averageSavePct = averageSavePct;
        }

        public double getAverageGoalsPerGame() {
            return averageGoalsPerGame;
        }

        public void setAverageGoalsPerGame(double averageGoalsPerGame) {
            this.averageGoalsPerGame = averageGoalsPerGame;
        }
    }

    /**
     * Pool sizes for slate runs. Player tasks run on the slate pool, their repository
     * reads on the read pool.
     */
    public static class Workers {

        private int slatePoolSize = 8;
        private int readPoolSize = 16;
        private int queueCapacity = 1024;

        public int getSlatePoolSize() {
            return slatePoolSize;
        }

        public void setSlatePoolSize(int slatePoolSize) {
            this.slatePoolSize = slatePoolSize;
        }

        public int getReadPoolSize() {
            return readPoolSize;
        }

        public void setReadPoolSize(int readPoolSize) {
            this.readPoolSize = readPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
