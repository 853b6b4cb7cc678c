package com.hockey.prediction.engine;

import com.hockey.prediction.engine.factor.FactorInputs;
import com.hockey.prediction.model.ConfidenceTier;
import com.hockey.prediction.model.ScoringModel;
import com.hockey.prediction.stats.GameLogEntry;
import com.hockey.prediction.stats.GoalieContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Short explanations shown next to a forecast. Read-only with respect to the score.
 */
final class Highlights {

    private static final double HOT_RATIO = 1.2;
    private static final double COLD_RATIO = 0.8;
    private static final double STRONG_HISTORY_RATIO = 1.3;
    private static final double WEAK_HISTORY_RATIO = 0.7;
    private static final double GOALIE_MARGIN = 0.01;
    private static final double PACE_MARGIN = 0.5;

    private Highlights() {
    }

    static List<String> describe(FactorInputs inputs, ConfidenceTier confidence, ScoringModel model) {
        List<String> notes = new ArrayList<>();
        double seasonPpg = inputs.seasonPointsPerGame();

        List<GameLogEntry> recent = inputs.recentGames()
                .subList(0, Math.min(inputs.recentGames().size(), model.getRecentFormWindow()));
        if (!recent.isEmpty()) {
            int points = recent.stream().mapToInt(GameLogEntry::points).sum();
            double recentPpg = (double) points / recent.size();
            if (recentPpg > seasonPpg * HOT_RATIO) {
                notes.add(format("Hot streak: %.2f PPG in last %d games", recentPpg, recent.size()));
            } else if (recentPpg < seasonPpg * COLD_RATIO) {
                notes.add(format("Cold streak: %.2f PPG in last %d games", recentPpg, recent.size()));
            }
        }

        int meetings = inputs.headToHead().sampleSize();
        if (meetings >= model.getHeadToHeadMinGames()) {
            double h2hPpg = inputs.headToHead().pointsPerGame();
            if (h2hPpg > seasonPpg * STRONG_HISTORY_RATIO) {
                notes.add(format("Strong history vs %s: %.2f PPG in %d games", inputs.opponent(), h2hPpg, meetings));
            } else if (h2hPpg < seasonPpg * WEAK_HISTORY_RATIO) {
                notes.add(format("Struggles vs %s: %.2f PPG in %d games", inputs.opponent(), h2hPpg, meetings));
            }
        }

        GoalieContext goalie = inputs.opposingGoalie();
        if (goalie != null && goalie.isStarterAnnounced()) {
            double average = goalie.leagueAverageSavePct() != null
                    ? goalie.leagueAverageSavePct()
                    : model.getLeagueAverageSavePct();
            double edge = average - goalie.savePct();
            String name = goalie.goalieName() != null ? goalie.goalieName() : "opposing starter";
            if (edge > GOALIE_MARGIN) {
                notes.add(format("Favorable goalie matchup: %s (%.3f SV%%)", name, goalie.savePct()));
            } else if (edge < -GOALIE_MARGIN) {
                notes.add(format("Tough goalie matchup: %s (%.3f SV%%)", name, goalie.savePct()));
            }
        } else {
            notes.add("Opposing starter not announced");
        }

        if (inputs.ownTeam() != null && inputs.opponentTeam() != null) {
            double expected = inputs.ownTeam().goalsForPerGame() + inputs.opponentTeam().goalsAgainstPerGame();
            double average = model.getLeagueAverageGoalsPerGame() * 2;
            if (expected > average + PACE_MARGIN) {
                notes.add(format("High-scoring environment: %.1f combined goals per game", expected));
            } else if (expected < average - PACE_MARGIN) {
                notes.add(format("Low-scoring environment: %.1f combined goals per game", expected));
            }
        }

        if (confidence == ConfidenceTier.LOW) {
            notes.add("Limited data - prediction less reliable");
        }
        return notes;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
