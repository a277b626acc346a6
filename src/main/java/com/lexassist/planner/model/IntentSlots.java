package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured attributes extracted from a question. Every field is optional; a bag with no
 * populated field is never attached to an intent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntentSlots(
        @JsonProperty("procedure_code") String procedureCode,
        @JsonProperty("court_level") CourtLevel courtLevel,
        @JsonProperty("case_category") String caseCategory,
        @JsonProperty("law_article") String lawArticle,
        @JsonProperty("section_focus") List<SectionType> sectionFocus,
        @JsonProperty("money_terms") MoneyTerms moneyTerms,
        @JsonProperty("desired_output") String desiredOutput
) {
    public IntentSlots {
        sectionFocus = sectionFocus == null ? null : List.copyOf(sectionFocus);
    }

    public boolean isEmpty() {
        return isBlank(procedureCode)
                && courtLevel == null
                && isBlank(caseCategory)
                && isBlank(lawArticle)
                && (sectionFocus == null || sectionFocus.isEmpty())
                && (moneyTerms == null || moneyTerms.isEmpty())
                && isBlank(desiredOutput);
    }

    RawSlots toRaw() {
        return RawSlots.builder()
                .procedureCode(procedureCode)
                .courtLevel(courtLevel != null ? courtLevel.getValue() : null)
                .caseCategory(caseCategory)
                .lawArticle(lawArticle)
                .sectionFocus(sectionFocus == null ? null : sectionFocus.stream().map(Enum::name).toList())
                .moneyTerms(moneyTerms)
                .desiredOutput(desiredOutput)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
