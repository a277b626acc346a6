package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Sanitized interpretation of a user's legal question. Instances are produced by the
 * intent sanitizer only, so {@code domains} and {@code sections} are never empty and every
 * section is a member of {@link SectionType}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryIntent(
        String intent,
        double confidence,
        List<String> domains,
        @JsonProperty("required_entities") List<String> requiredEntities,
        List<SectionType> sections,
        @JsonProperty("time_range") TimeRange timeRange,
        @JsonProperty("reasoning_budget") ReasoningBudget reasoningBudget,
        IntentSlots slots
) {
    public QueryIntent {
        domains = domains == null ? List.of() : List.copyOf(domains);
        requiredEntities = requiredEntities == null ? List.of() : List.copyOf(requiredEntities);
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public Optional<IntentSlots> slotsIfPresent() {
        return Optional.ofNullable(slots);
    }

    public Optional<CourtLevel> courtLevel() {
        return slotsIfPresent().map(IntentSlots::courtLevel);
    }

    /**
     * Converts back to the loosely-typed form, e.g. to re-run it through the sanitizer.
     */
    public RawIntent toRaw() {
        return RawIntent.builder()
                .intent(intent)
                .confidence(confidence)
                .domains(domains)
                .requiredEntities(requiredEntities)
                .sections(sections.stream().map(Enum::name).toList())
                .timeRange(timeRange)
                .reasoningBudget(reasoningBudget != null ? reasoningBudget.getValue() : null)
                .slots(slots != null ? slots.toRaw() : null)
                .build();
    }
}
