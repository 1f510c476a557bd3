package com.eainde.refinement.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Run mode. Semi-automatic runs hold a stricter accept threshold and escalate
 * to human review instead of settling for a best-effort result.
 */
public enum OperationMode {
    FULL_AUTO("full-auto"),
    SEMI_AUTO("semi-auto");

    private final String wireName;

    OperationMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OperationMode fromWireName(String value) {
        for (OperationMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown operation mode: " + value);
    }
}
