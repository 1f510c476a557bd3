package com.eainde.refinement.status;

import com.eainde.refinement.config.ModeThresholds;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Quality band of a best-effort document, judged against its mode's thresholds.
 */
public enum QualityStatus {
    /** At or above the accept threshold. */
    GOOD("good"),
    /** In the good-enough band. */
    ACCEPTABLE("acceptable"),
    BELOW_STANDARD("below_standard");

    private final String wireName;

    QualityStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static QualityStatus of(double score, ModeThresholds thresholds) {
        if (thresholds.accepts(score)) {
            return GOOD;
        }
        return thresholds.isGoodEnough(score) ? ACCEPTABLE : BELOW_STANDARD;
    }
}
