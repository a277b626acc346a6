package com.lexassist.planner.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for one search call against a domain adapter. Paging can be overridden by the
 * caller before dispatch through the {@code with*} copies.
 */
public record QueryParams(List<WhereClause> where, QueryMeta meta, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int DEFAULT_OFFSET = 0;

    public QueryParams {
        where = where == null ? List.of() : List.copyOf(where);
    }

    public QueryParams withLimit(int newLimit) {
        return new QueryParams(where, meta, newLimit, offset);
    }

    public QueryParams withOffset(int newOffset) {
        return new QueryParams(where, meta, limit, newOffset);
    }

    public QueryParams withAdditionalWhere(List<WhereClause> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<WhereClause> merged = new ArrayList<>(where);
        merged.addAll(extra);
        return new QueryParams(merged, meta, limit, offset);
    }
}
