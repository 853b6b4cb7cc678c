package com.hockey.prediction.engine.factor;

import com.hockey.prediction.stats.GameLogEntry;

import java.util.List;

/**
 * Rate-to-score conversions shared by the factor calculators.
 */
final class Normalization {

    static final double NEUTRAL = 0.5;

    private Normalization() {
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    static double againstCeiling(double rate, double ceiling) {
        return clamp(rate / ceiling);
    }

    static double pointsPerGame(List<GameLogEntry> games) {
        if (games.isEmpty()) {
            return 0.0;
        }
        int points = 0;
        for (GameLogEntry g : games) {
            points += g.points();
        }
        return (double) points / games.size();
    }
}
