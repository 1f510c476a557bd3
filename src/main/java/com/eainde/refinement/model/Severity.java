package com.eainde.refinement.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue severity and task priority. Declaration order is priority order.
 */
public enum Severity {
    CRITICAL("critical"),
    MAJOR("major"),
    MINOR("minor");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        for (Severity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }

    /**
     * @return the more urgent of the two
     */
    public static Severity mostSevere(Severity a, Severity b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
