package com.eainde.refinement.status;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the refinement loop stopped.
 */
public enum TerminationReason {
    NO_TASKS("no_tasks"),
    CONVERGED("converged"),
    ALL_SECTIONS_LOCKED("all_sections_locked"),
    MAX_ITERATIONS("max_iterations"),
    TIMEOUT("timeout");

    private final String wireName;

    TerminationReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
