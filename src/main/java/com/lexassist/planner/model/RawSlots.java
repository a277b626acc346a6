package com.lexassist.planner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawSlots {
    private String procedureCode;
    private String courtLevel;
    private String caseCategory;
    private String lawArticle;
    private List<String> sectionFocus;
    private MoneyTerms moneyTerms;
    private String desiredOutput;
}
