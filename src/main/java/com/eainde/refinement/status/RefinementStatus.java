package com.eainde.refinement.status;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal classification of a refinement run.
 */
public enum RefinementStatus {
    /** Final score reached the mode's accept threshold. */
    ACCEPTED("accepted"),
    /** Final score in the good-enough band below the accept threshold. */
    ACCEPTED_WARNING("accepted_warning"),
    /** Full-auto run that stopped short; the best available document is returned. */
    BEST_EFFORT("best_effort"),
    /** Semi-auto run that needs human review. */
    ESCALATED("escalated");

    private final String wireName;

    RefinementStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
