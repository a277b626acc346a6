package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QueryPlan(
        String query,
        @JsonProperty("search_query") String searchQuery,
        QueryIntent intent,
        List<EndpointQuery> endpoints,
        @JsonProperty("answer_sections") List<SectionType> answerSections
) {
    public QueryPlan {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        answerSections = answerSections == null ? List.of() : List.copyOf(answerSections);
    }

    public List<String> endpointNames() {
        return endpoints.stream().map(EndpointQuery::endpoint).toList();
    }
}
