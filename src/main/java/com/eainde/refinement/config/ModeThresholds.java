package com.eainde.refinement.config;

/**
 * Score thresholds for one operation mode.
 *
 * @param acceptThreshold     score at or above which a run is {@code accepted}
 * @param goodEnoughThreshold lower edge of the {@code accepted_warning} band
 */
public record ModeThresholds(double acceptThreshold, double goodEnoughThreshold) {

    public ModeThresholds {
        if (!inUnitRange(acceptThreshold) || !inUnitRange(goodEnoughThreshold)) {
            throw new RefinementConfigurationException(
                    "Thresholds must be within [0, 1]: accept=" + acceptThreshold
                            + ", goodEnough=" + goodEnoughThreshold);
        }
        if (goodEnoughThreshold > acceptThreshold) {
            throw new RefinementConfigurationException(
                    "goodEnoughThreshold (" + goodEnoughThreshold
                            + ") must not exceed acceptThreshold (" + acceptThreshold + ")");
        }
    }

    public boolean accepts(double score) {
        return score >= acceptThreshold;
    }

    public boolean isGoodEnough(double score) {
        return score >= goodEnoughThreshold;
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
