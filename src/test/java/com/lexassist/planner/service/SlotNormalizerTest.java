package com.lexassist.planner.service;

import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.SectionType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotNormalizerTest {

    @Test
    void normalizesSectionNamesLeniently() {
        assertThat(SlotNormalizer.normalizeSection("court_reasoning")).contains(SectionType.COURT_REASONING);
        assertThat(SlotNormalizer.normalizeSection(" Law References ")).contains(SectionType.LAW_REFERENCES);
        assertThat(SlotNormalizer.normalizeSection("law-references")).contains(SectionType.LAW_REFERENCES);
        assertThat(SlotNormalizer.normalizeSection("summary")).isEmpty();
        assertThat(SlotNormalizer.normalizeSection(null)).isEmpty();
    }

    @Test
    void dropsUnknownSectionsAndKeepsFirstSeenOrder() {
        List<SectionType> sections = SlotNormalizer.normalizeSections(
                Arrays.asList("decision", "bogus", "FACTS", "Decision", null, ""));

        assertThat(sections).containsExactly(SectionType.DECISION, SectionType.FACTS);
        assertThat(SlotNormalizer.normalizeSections(List.of("nothing", "useful"))).isEmpty();
        assertThat(SlotNormalizer.normalizeSections(null)).isEmpty();
    }

    @Test
    void resolvesCourtLevelSynonyms() {
        assertThat(SlotNormalizer.normalizeCourtLevel("GrandChamber")).contains(CourtLevel.GRAND_CHAMBER);
        assertThat(SlotNormalizer.normalizeCourtLevel("Grand Chamber")).contains(CourtLevel.GRAND_CHAMBER);
        assertThat(SlotNormalizer.normalizeCourtLevel("Велика Палата ВС")).contains(CourtLevel.GRAND_CHAMBER);
        assertThat(SlotNormalizer.normalizeCourtLevel("ВП")).contains(CourtLevel.GRAND_CHAMBER);

        assertThat(SlotNormalizer.normalizeCourtLevel("SC")).contains(CourtLevel.SUPREME_COURT);
        assertThat(SlotNormalizer.normalizeCourtLevel("Supreme Court")).contains(CourtLevel.SUPREME_COURT);
        assertThat(SlotNormalizer.normalizeCourtLevel("Верховний Суд")).contains(CourtLevel.SUPREME_COURT);
        assertThat(SlotNormalizer.normalizeCourtLevel("КЦС")).contains(CourtLevel.SUPREME_COURT);
        assertThat(SlotNormalizer.normalizeCourtLevel("Касаційний цивільний суд")).contains(CourtLevel.SUPREME_COURT);

        assertThat(SlotNormalizer.normalizeCourtLevel("cassation")).contains(CourtLevel.CASSATION);
        assertThat(SlotNormalizer.normalizeCourtLevel("касаційна інстанція")).contains(CourtLevel.CASSATION);
        assertThat(SlotNormalizer.normalizeCourtLevel("Appellate")).contains(CourtLevel.APPEAL);
        assertThat(SlotNormalizer.normalizeCourtLevel("апеляційний суд")).contains(CourtLevel.APPEAL);
        assertThat(SlotNormalizer.normalizeCourtLevel("first_instance")).contains(CourtLevel.FIRST_INSTANCE);
        assertThat(SlotNormalizer.normalizeCourtLevel("суд першої інстанції")).contains(CourtLevel.FIRST_INSTANCE);
    }

    @Test
    void dropsUnrecognizedCourtLevels() {
        assertThat(SlotNormalizer.normalizeCourtLevel("district")).isEmpty();
        assertThat(SlotNormalizer.normalizeCourtLevel("  ")).isEmpty();
        assertThat(SlotNormalizer.normalizeCourtLevel(null)).isEmpty();
    }

    @Test
    void blankTextBecomesNull() {
        assertThat(SlotNormalizer.normalizeText("  ст. 625 ЦК ")).isEqualTo("ст. 625 ЦК");
        assertThat(SlotNormalizer.normalizeText(" ")).isNull();
    }
}
