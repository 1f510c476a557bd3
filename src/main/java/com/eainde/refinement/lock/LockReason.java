package com.eainde.refinement.lock;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a section stopped accepting repairs.
 */
public enum LockReason {
    MAX_EDITS("max_edits"),
    REGRESSION("regression");

    private final String wireName;

    LockReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
