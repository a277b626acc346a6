package com.lexassist.planner.model;

public record WhereClause(String field, String operator, Object value) {

    public static WhereClause gte(String field, Object value) {
        return new WhereClause(field, "$gte", value);
    }

    public static WhereClause lte(String field, Object value) {
        return new WhereClause(field, "$lte", value);
    }

    public static WhereClause eq(String field, Object value) {
        return new WhereClause(field, "=", value);
    }
}
