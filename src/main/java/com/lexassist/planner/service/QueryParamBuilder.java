package com.lexassist.planner.service;

import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.IntentSlots;
import com.lexassist.planner.model.ProcedureCode;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.QueryMeta;
import com.lexassist.planner.model.QueryParams;
import com.lexassist.planner.model.TimeRange;
import com.lexassist.planner.model.WhereClause;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lowers an intent into search parameters understood by the domain adapters.
 */
@Component
public class QueryParamBuilder {

    public static final String DATE_FIELD = "date_publ";

    public QueryParams build(QueryIntent intent) {
        return build(intent, null);
    }

    public QueryParams build(QueryIntent intent, String searchText) {
        List<WhereClause> where = new ArrayList<>();
        TimeRange range = intent.timeRange();
        if (range != null) {
            if (StringUtils.hasText(range.from())) {
                where.add(WhereClause.gte(DATE_FIELD, range.from()));
            }
            if (StringUtils.hasText(range.to())) {
                where.add(WhereClause.lte(DATE_FIELD, range.to()));
            }
        }

        QueryMeta meta = new QueryMeta(
                searchText,
                intent.requiredEntities().isEmpty() ? null : intent.requiredEntities(),
                Map.of(DATE_FIELD, "desc")
        );
        return new QueryParams(where, meta, QueryParams.DEFAULT_LIMIT, QueryParams.DEFAULT_OFFSET);
    }

    /**
     * Extra filters for the court-decision endpoint: cassation instance for Supreme Court
     * questions and the justice kind of the procedure code.
     */
    public List<WhereClause> courtFilters(QueryIntent intent) {
        IntentSlots slots = intent.slots();
        if (slots == null) {
            return List.of();
        }
        List<WhereClause> filters = new ArrayList<>();
        CourtLevel level = slots.courtLevel();
        if (level != null && level.isSupremeCourt()) {
            filters.add(WhereClause.eq("instance_code", 1));
        }
        if (StringUtils.hasText(slots.procedureCode())) {
            ProcedureCode.fromLabel(slots.procedureCode())
                    .ifPresent(code -> filters.add(WhereClause.eq("justice_kind", code.getJusticeKind())));
        }
        return List.copyOf(filters);
    }
}
