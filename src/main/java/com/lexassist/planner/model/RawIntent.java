package com.lexassist.planner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Classifier output before sanitization. Nothing here is trusted: enum-like fields are plain
 * strings and any field may be null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawIntent {
    private String intent;
    private Double confidence;
    private List<String> domains;
    private List<String> requiredEntities;
    private List<String> sections;
    private TimeRange timeRange;
    private String reasoningBudget;
    private RawSlots slots;
}
