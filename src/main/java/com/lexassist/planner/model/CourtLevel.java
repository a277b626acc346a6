package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum CourtLevel {
    FIRST_INSTANCE("first_instance"),
    APPEAL("appeal"),
    CASSATION("cassation"),
    SUPREME_COURT("SC"),
    GRAND_CHAMBER("GrandChamber");

    private final String value;

    CourtLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Exact match on the wire value; synonyms are resolved by the slot normalizer.
     */
    public static Optional<CourtLevel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CourtLevel level : values()) {
            if (level.value.equals(value)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Supreme Court and Grand Chamber decisions are both published by the cassation instance.
     */
    public boolean isSupremeCourt() {
        return this == SUPREME_COURT || this == GRAND_CHAMBER;
    }
}
