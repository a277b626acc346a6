package com.lexassist.planner.model;

import java.util.List;

/**
 * Closed taxonomy of court-decision sections a caller may ask to have extracted.
 */
public enum SectionType {
    FACTS,
    CLAIMS,
    LAW_REFERENCES,
    COURT_REASONING,
    DECISION,
    AMOUNTS;

    /**
     * Used whenever a classifier yields no valid section.
     */
    public static final List<SectionType> DEFAULT_SECTIONS = List.of(COURT_REASONING, DECISION);
}
