package com.lexassist.planner.service;

import com.lexassist.planner.model.EndpointQuery;
import com.lexassist.planner.model.IntentSlots;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.QueryParams;
import com.lexassist.planner.model.QueryPlan;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.SectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for tool handlers: classifies a question, routes it and assembles the
 * per-endpoint search parameters.
 */
@Service
public class QueryPlanningService {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanningService.class);

    static final List<SectionType> ANSWER_SECTIONS_FALLBACK =
            List.of(SectionType.COURT_REASONING, SectionType.DECISION, SectionType.LAW_REFERENCES);

    private final HeuristicClassifier heuristicClassifier;
    private final ModelAssistedClassifier modelAssistedClassifier;
    private final DomainRouter domainRouter;
    private final QueryParamBuilder queryParamBuilder;
    private final SearchQueryOptimizer searchQueryOptimizer;
    private final int defaultLimit;

    public QueryPlanningService(HeuristicClassifier heuristicClassifier,
                                ModelAssistedClassifier modelAssistedClassifier,
                                DomainRouter domainRouter,
                                QueryParamBuilder queryParamBuilder,
                                SearchQueryOptimizer searchQueryOptimizer,
                                @Value("${app.planner.default-limit:50}") int defaultLimit) {
        this.heuristicClassifier = heuristicClassifier;
        this.modelAssistedClassifier = modelAssistedClassifier;
        this.domainRouter = domainRouter;
        this.queryParamBuilder = queryParamBuilder;
        this.searchQueryOptimizer = searchQueryOptimizer;
        this.defaultLimit = defaultLimit > 0 ? defaultLimit : QueryParams.DEFAULT_LIMIT;
    }

    /**
     * @throws IllegalArgumentException for an unknown budget name or a blank query
     */
    public CompletableFuture<QueryIntent> classify(String query, String budget) {
        return classify(query, ReasoningBudget.fromValue(budget));
    }

    public CompletableFuture<QueryIntent> classify(String query, ReasoningBudget budget) {
        requireQuery(query);
        if (budget == null) {
            throw new IllegalArgumentException("reasoning budget must not be null");
        }
        if (budget == ReasoningBudget.QUICK) {
            return CompletableFuture.completedFuture(heuristicClassifier.classifyQuick(query));
        }
        return modelAssistedClassifier.classifyDeep(query, budget);
    }

    public CompletableFuture<QueryPlan> plan(String query, String budget) {
        return plan(query, ReasoningBudget.fromValue(budget));
    }

    public CompletableFuture<QueryPlan> plan(String query, ReasoningBudget budget) {
        return classify(query, budget)
                .thenCompose(intent -> searchQueryOptimizer.optimize(query, intent, budget)
                        .thenApply(searchQuery -> assemble(query, searchQuery, intent)));
    }

    QueryPlan assemble(String query, String searchQuery, QueryIntent intent) {
        List<String> endpoints = domainRouter.selectEndpoints(intent);
        List<EndpointQuery> queries = new ArrayList<>(endpoints.size());
        for (String endpoint : endpoints) {
            QueryParams params = queryParamBuilder.build(intent, searchQuery).withLimit(defaultLimit);
            if (DomainRouter.COURT.equals(endpoint)) {
                params = params.withAdditionalWhere(queryParamBuilder.courtFilters(intent));
            }
            queries.add(new EndpointQuery(endpoint, params));
        }

        QueryPlan plan = new QueryPlan(query, searchQuery, intent, queries, answerSections(intent));
        logger.info("Planned query: intent={} budget={} endpoints={} searchQuery='{}'",
                intent.intent(), intent.reasoningBudget() != null ? intent.reasoningBudget().getValue() : null,
                plan.endpointNames(), searchQuery);
        return plan;
    }

    /**
     * Sections to render in the answer: the slot focus if any, else the intent sections.
     */
    public List<SectionType> answerSections(QueryIntent intent) {
        IntentSlots slots = intent.slots();
        if (slots != null && slots.sectionFocus() != null && !slots.sectionFocus().isEmpty()) {
            return slots.sectionFocus();
        }
        if (!intent.sections().isEmpty()) {
            return intent.sections();
        }
        return ANSWER_SECTIONS_FALLBACK;
    }

    private static void requireQuery(String query) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }
    }
}
