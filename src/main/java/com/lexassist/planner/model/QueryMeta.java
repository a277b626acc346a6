package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryMeta(
        String search,
        @JsonProperty("search_entities") List<String> searchEntities,
        Map<String, String> order
) {
    public QueryMeta {
        searchEntities = searchEntities == null ? null : List.copyOf(searchEntities);
        order = order == null ? Map.of() : Map.copyOf(order);
    }
}
