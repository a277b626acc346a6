package com.lexassist.planner.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ukrainian procedural codes and the {@code justice_kind} filter value the court-decision
 * search backend uses for each of them.
 */
public enum ProcedureCode {
    CIVIL("ЦПК", "cpc", 1),
    CRIMINAL("КПК", "crpc", 2),
    COMMERCIAL("ГПК", "gpc", 3),
    ADMINISTRATIVE("КАС", "cac", 4);

    private final String label;
    private final String shortCode;
    private final int justiceKind;

    ProcedureCode(String label, String shortCode, int justiceKind) {
        this.label = label;
        this.shortCode = shortCode;
        this.justiceKind = justiceKind;
    }

    public String getLabel() {
        return label;
    }

    public String getShortCode() {
        return shortCode;
    }

    public int getJusticeKind() {
        return justiceKind;
    }

    public static Optional<ProcedureCode> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("epc".equals(normalized)) {
            return Optional.of(COMMERCIAL);
        }
        for (ProcedureCode code : values()) {
            if (code.getLabel().toLowerCase(Locale.ROOT).equals(normalized) || code.getShortCode().equals(normalized)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
