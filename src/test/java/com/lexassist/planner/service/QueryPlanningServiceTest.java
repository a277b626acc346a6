package com.lexassist.planner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.EndpointQuery;
import com.lexassist.planner.model.IntentSlots;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.QueryPlan;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.ResponseFormat;
import com.lexassist.planner.model.SectionType;
import com.lexassist.planner.model.WhereClause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryPlanningServiceTest {

    private static final String SC_QUERY = "Яка позиція Верховного Суду щодо поновлення строку на апеляційне оскарження?";

    @Mock
    private CompletionService completionService;

    private QueryPlanningService planningService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        Executor direct = Runnable::run;
        IntentSanitizer sanitizer = new IntentSanitizer();
        HeuristicClassifier heuristic = new HeuristicClassifier(sanitizer);
        planningService = new QueryPlanningService(
                heuristic,
                new ModelAssistedClassifier(completionService, heuristic, sanitizer, objectMapper, direct),
                new DomainRouter(),
                new QueryParamBuilder(),
                new SearchQueryOptimizer(completionService, objectMapper, direct),
                25);
    }

    @Test
    void quickPlanStaysOffline() {
        QueryPlan plan = planningService.plan(SC_QUERY, "quick").join();

        assertThat(plan.query()).isEqualTo(SC_QUERY);
        assertThat(plan.searchQuery()).isEqualTo(SC_QUERY);
        assertThat(plan.intent().intent()).isEqualTo("supreme_court_position");
        assertThat(plan.endpointNames()).containsExactly("court");
        assertThat(plan.endpoints().get(0).params().where())
                .containsExactly(new WhereClause("instance_code", "=", 1));
        assertThat(plan.endpoints().get(0).params().limit()).isEqualTo(25);
        assertThat(plan.answerSections()).containsExactly(SectionType.COURT_REASONING);
        verifyNoInteractions(completionService);
    }

    @Test
    void standardPlanUsesModelForClassificationAndSearchText() {
        when(completionService.complete(anyString(), eq(ResponseFormat.JSON_OBJECT))).thenReturn(
                "{\"intent\": \"tax_dispute\", \"domains\": [\"court\"], \"sections\": [\"DECISION\"],"
                        + " \"time_range\": {\"from\": \"2023-01-01\", \"to\": \"2023-12-31\"},"
                        + " \"slots\": {\"procedure_code\": \"КАС\"}}",
                "{\"search_query\": \"податкове повідомлення-рішення оскарження\"}");

        QueryPlan plan = planningService.plan("Як оскаржити податкове повідомлення-рішення?", ReasoningBudget.STANDARD)
                .join();

        assertThat(plan.intent().reasoningBudget()).isEqualTo(ReasoningBudget.STANDARD);
        assertThat(plan.searchQuery()).isEqualTo("податкове повідомлення-рішення оскарження");
        assertThat(plan.endpointNames()).containsExactly("court", "npa");

        EndpointQuery court = plan.endpoints().get(0);
        EndpointQuery npa = plan.endpoints().get(1);
        assertThat(court.params().where()).containsExactly(
                WhereClause.gte("date_publ", "2023-01-01"),
                WhereClause.lte("date_publ", "2023-12-31"),
                WhereClause.eq("justice_kind", 4));
        assertThat(npa.params().where()).containsExactly(
                WhereClause.gte("date_publ", "2023-01-01"),
                WhereClause.lte("date_publ", "2023-12-31"));
        assertThat(npa.params().meta().search()).isEqualTo("податкове повідомлення-рішення оскарження");
        assertThat(plan.answerSections()).containsExactly(SectionType.DECISION);
        verify(completionService, times(2)).complete(anyString(), eq(ResponseFormat.JSON_OBJECT));
    }

    @Test
    void modelOutageStillProducesAPlan() {
        when(completionService.complete(anyString(), eq(ResponseFormat.JSON_OBJECT)))
                .thenThrow(new ThrottledException("Bedrock throttling after retries"));

        QueryPlan plan = planningService.plan(SC_QUERY, "deep").join();

        assertThat(plan.intent().intent()).isEqualTo("supreme_court_position");
        assertThat(plan.intent().reasoningBudget()).isEqualTo(ReasoningBudget.QUICK);
        assertThat(plan.searchQuery()).isEqualTo(SC_QUERY);
    }

    @Test
    void rejectsBadInputBeforeDoingAnyWork() {
        assertThatThrownBy(() -> planningService.plan(SC_QUERY, "turbo"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planningService.classify("  ", ReasoningBudget.QUICK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planningService.classify(SC_QUERY, (ReasoningBudget) null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(completionService);
    }

    @Test
    void answerSectionsPreferSlotFocus() {
        IntentSlots focus = new IntentSlots(null, CourtLevel.APPEAL, null, null,
                List.of(SectionType.AMOUNTS), null, null);

        assertThat(planningService.answerSections(intent(List.of(SectionType.FACTS), focus)))
                .containsExactly(SectionType.AMOUNTS);
        assertThat(planningService.answerSections(intent(List.of(SectionType.FACTS), null)))
                .containsExactly(SectionType.FACTS);
        assertThat(planningService.answerSections(intent(List.of(), null)))
                .containsExactly(SectionType.COURT_REASONING, SectionType.DECISION, SectionType.LAW_REFERENCES);
    }

    private static QueryIntent intent(List<SectionType> sections, IntentSlots slots) {
        return new QueryIntent("general_search", 0.7, List.of("court"), List.of(), sections,
                null, ReasoningBudget.STANDARD, slots);
    }
}
