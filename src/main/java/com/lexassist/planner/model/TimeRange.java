package com.lexassist.planner.model;

/**
 * Publication-date window, ISO-8601 dates passed through verbatim to the search backends.
 */
public record TimeRange(String from, String to) {
}
