package com.lexassist.planner.service;

import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.IntentSlots;
import com.lexassist.planner.model.MoneyTerms;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.SectionType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicClassifierTest {

    private final HeuristicClassifier classifier = new HeuristicClassifier(new IntentSanitizer());

    @Test
    void rulesAreCheckedInDocumentedOrder() {
        assertThat(classifier.rules()).extracting(KeywordRule::intent).containsExactly(
                "supreme_court_position",
                "procedural_deadlines",
                "admissibility_and_formal_requirements",
                "jurisdiction_and_competence",
                "evidence_and_standards",
                "interim_measures",
                "amounts_and_costs",
                "two_sided_practice",
                "parliament_search",
                "registry_search",
                "consumer_penalty_delay",
                "tax_dispute",
                "labor_dispute");
    }

    @Test
    void supremeCourtPositionWinsOverDeadlinesAndAppeal() {
        QueryIntent intent = classifier.classifyQuick(
                "Яка позиція Верховного Суду щодо поновлення строку на апеляційне оскарження?");

        assertThat(intent.intent()).isEqualTo("supreme_court_position");
        assertThat(intent.domains()).containsExactly("court");
        assertThat(intent.sections()).containsExactly(SectionType.COURT_REASONING);
        assertThat(intent.confidence()).isEqualTo(0.6);
        assertThat(intent.reasoningBudget()).isEqualTo(ReasoningBudget.QUICK);
        assertThat(intent.courtLevel()).contains(CourtLevel.SUPREME_COURT);
    }

    @Test
    void registryQuestionsGoToTheRegistry() {
        QueryIntent intent = classifier.classifyQuick("Знайди бенефіціарів компанії за кодом ЄДРПОУ 12345678");

        assertThat(intent.intent()).isEqualTo("registry_search");
        assertThat(intent.domains()).containsExactly("registry");
        assertThat(intent.sections()).containsExactly(SectionType.FACTS);
        assertThat(intent.slots()).isNull();
    }

    @Test
    void parliamentQuestionsAreNotMistakenForTheSupremeCourt() {
        QueryIntent intent = classifier.classifyQuick("Як голосували депутати Верховної Ради за законопроект про мобілізацію?");

        assertThat(intent.intent()).isEqualTo("parliament_search");
        assertThat(intent.domains()).containsExactly("parliament", "npa");
        assertThat(intent.sections()).containsExactly(SectionType.LAW_REFERENCES);
    }

    @Test
    void deadlinesRuleExtractsProcedureCode() {
        QueryIntent intent = classifier.classifyQuick("Як поновити пропущений строк на подання позову за ЦПК?");

        assertThat(intent.intent()).isEqualTo("procedural_deadlines");
        assertThat(intent.domains()).containsExactly("court", "npa");
        assertThat(intent.sections())
                .containsExactly(SectionType.COURT_REASONING, SectionType.DECISION, SectionType.LAW_REFERENCES);
        assertThat(intent.slots().procedureCode()).isEqualTo("ЦПК");
    }

    @Test
    void amountsRuleExtractsMoneyTerms() {
        QueryIntent intent = classifier.classifyQuick("Стягнення інфляційних втрат та 3% річних з боржника");

        assertThat(intent.intent()).isEqualTo("amounts_and_costs");
        assertThat(intent.sections()).containsExactly(SectionType.AMOUNTS, SectionType.COURT_REASONING);
        assertThat(intent.slots().moneyTerms()).isEqualTo(new MoneyTerms(null, true, true, null));
    }

    @Test
    void evidenceRule() {
        QueryIntent intent = classifier.classifyQuick("Чи є електронне листування належним доказом?");

        assertThat(intent.intent()).isEqualTo("evidence_and_standards");
        assertThat(intent.sections()).containsExactly(SectionType.FACTS, SectionType.COURT_REASONING);
    }

    @Test
    void domainClustersKeepDefaultSections() {
        QueryIntent tax = classifier.classifyQuick("Спір з податковою щодо штрафних санкцій");
        QueryIntent labor = classifier.classifyQuick("Незаконне звільнення працівника");

        assertThat(tax.intent()).isEqualTo("tax_dispute");
        assertThat(tax.domains()).containsExactly("court", "npa");
        assertThat(tax.sections()).containsExactly(SectionType.COURT_REASONING, SectionType.DECISION);
        assertThat(tax.slots().moneyTerms()).isEqualTo(new MoneyTerms(true, null, null, null));
        assertThat(labor.intent()).isEqualTo("labor_dispute");
        assertThat(labor.domains()).containsExactly("court", "echr");
    }

    @Test
    void unmatchedQueriesGetTheGeneralIntent() {
        QueryIntent intent = classifier.classifyQuick("Hello world");

        assertThat(intent.intent()).isEqualTo("general_search");
        assertThat(intent.domains()).containsExactly("court");
        assertThat(intent.sections()).containsExactly(SectionType.COURT_REASONING, SectionType.DECISION);
        assertThat(intent.slots()).isNull();
    }

    @Test
    void grandChamberOutranksSupremeCourtInSlots() {
        QueryIntent intent = classifier.classifyQuick("Висновок Великої Палати Верховного Суду щодо підсудності");

        assertThat(intent.intent()).isEqualTo("supreme_court_position");
        assertThat(intent.courtLevel()).contains(CourtLevel.GRAND_CHAMBER);
    }

    @Test
    void procedureCodesMatchWholeWordsOnly() {
        IntentSlots slots = classifier.classifyQuick("Касаційна скарга у справі за КАС").slots();

        assertThat(slots.procedureCode()).isEqualTo("КАС");
        assertThat(slots.courtLevel()).isEqualTo(CourtLevel.CASSATION);
        assertThat(classifier.classifyQuick("Касаційна скарга").slots().procedureCode()).isNull();
    }

    @Test
    void desiredOutputIsDetected() {
        assertThat(classifier.classifyQuick("Зроби таблицю рішень про пеню").slots().desiredOutput())
                .isEqualTo("таблиця");
        assertThat(classifier.classifyQuick("Дай чеклист для позову").slots().desiredOutput())
                .isEqualTo("чеклист");
    }

    @Test
    void classificationIsTotalAndDeterministic() {
        List<String> queries = List.of("", "   ", "?!", "12345", "Яка позиція ВС?", "щось дивне \u0000 😀");
        for (String query : queries) {
            QueryIntent first = classifier.classifyQuick(query);

            assertThat(classifier.classifyQuick(query)).isEqualTo(first);
            assertThat(first.domains()).isNotEmpty();
            assertThat(first.sections()).isNotEmpty();
            assertThat(first.reasoningBudget()).isEqualTo(ReasoningBudget.QUICK);
        }
        assertThat(classifier.classifyQuick(null).intent()).isEqualTo("general_search");
    }
}
