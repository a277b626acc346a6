package com.lexassist.planner.model;

/**
 * A single ready-to-dispatch search: which domain endpoint, with which parameters.
 */
public record EndpointQuery(String endpoint, QueryParams params) {
}
