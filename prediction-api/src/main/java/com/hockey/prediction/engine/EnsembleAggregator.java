package com.hockey.prediction.engine;

import com.hockey.prediction.model.FactorName;
import com.hockey.prediction.model.ScoringFactor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Combines the six factors into the composite score: {@code sum(score * weight)}.
 *
 * <p>The sum is taken in exact decimal arithmetic in {@link FactorName} order and
 * rounded to a double once, so identical factors always give the identical composite
 * and a convex combination never drifts above 1.0. No clamping is applied.
 */
@Component
public class EnsembleAggregator {

    public double combine(Collection<ScoringFactor> factors) {
        Map<FactorName, ScoringFactor> byName = new EnumMap<>(FactorName.class);
        for (ScoringFactor factor : factors) {
            if (byName.put(factor.name(), factor) != null) {
                throw new IllegalArgumentException("Duplicate factor " + factor.name().getKey());
            }
        }
        if (byName.size() != FactorName.values().length) {
            throw new IllegalArgumentException("Expected all " + FactorName.values().length
                    + " factors, got " + byName.keySet());
        }
        BigDecimal weightSum = BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (ScoringFactor factor : byName.values()) {
            weightSum = weightSum.add(BigDecimal.valueOf(factor.weight()));
            total = total.add(factor.contribution());
        }
        if (weightSum.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException("Factor weights must sum to 1.0, sum was " + weightSum.toPlainString());
        }
        return total.doubleValue();
    }
}
