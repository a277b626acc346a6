package com.lexassist.planner.model;

/**
 * Hint passed to the completion service about the shape of the expected reply.
 */
public enum ResponseFormat {
    TEXT,
    JSON_OBJECT
}
