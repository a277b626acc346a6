package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Caller-chosen effort tier. {@code QUICK} never leaves the process.
 */
public enum ReasoningBudget {
    QUICK("quick"),
    STANDARD("standard"),
    DEEP("deep");

    private final String value;

    ReasoningBudget(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a budget supplied by a caller.
     *
     * @throws IllegalArgumentException for null or unknown values
     */
    public static ReasoningBudget fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("reasoning budget must not be null; expected one of quick, standard, deep");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReasoningBudget budget : values()) {
            if (budget.value.equals(normalized)) {
                return budget;
            }
        }
        throw new IllegalArgumentException("Unknown reasoning budget '" + value + "'; expected one of quick, standard, deep");
    }
}
