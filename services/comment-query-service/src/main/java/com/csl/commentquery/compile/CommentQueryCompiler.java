package com.csl.commentquery.compile;

import com.csl.commentquery.customize.CommentQueryCustomizer;
import com.csl.commentquery.date.DateRangeFilterCompiler;
import com.csl.commentquery.dsl.QueryDsl;
import com.csl.commentquery.meta.MetaQuery;
import com.csl.commentquery.meta.MetaQueryCompiler;
import com.csl.commentquery.relevance.RelevanceQueryBuilder;
import com.csl.commentquery.request.FilterRequest;
import com.csl.commentquery.request.QueryVars;
import com.csl.commentquery.sort.SortClause;
import com.csl.commentquery.sort.SortDirection;
import com.csl.commentquery.sort.SortKeyResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CommentQueryCompiler {
    private static final Logger log = LoggerFactory.getLogger(CommentQueryCompiler.class);

    static final String DEFAULT_ORDER_BY = "comment_date_gmt";
    static final String APPROVED_FIELD = "comment_approved";
    static final String USER_ID_FIELD = "user_id";
    static final String AUTHOR_EMAIL_FIELD = "comment_author_email.raw";
    static final String ID_FIELD = "comment_ID";

    private final CommentQueryProperties properties;
    private final SortKeyResolver sortKeyResolver;
    private final RelevanceQueryBuilder relevanceQueryBuilder;
    private final MetaQueryCompiler metaQueryCompiler;
    private final DateRangeFilterCompiler dateRangeFilterCompiler;
    private final List<CommentQueryCustomizer> customizers;
    private final List<FilterStep> steps;

    public CommentQueryCompiler(
        CommentQueryProperties properties,
        SortKeyResolver sortKeyResolver,
        RelevanceQueryBuilder relevanceQueryBuilder,
        MetaQueryCompiler metaQueryCompiler,
        DateRangeFilterCompiler dateRangeFilterCompiler,
        List<CommentQueryCustomizer> customizers
    ) {
        this.properties = properties;
        this.sortKeyResolver = sortKeyResolver;
        this.relevanceQueryBuilder = relevanceQueryBuilder;
        this.metaQueryCompiler = metaQueryCompiler;
        this.dateRangeFilterCompiler = dateRangeFilterCompiler;
        this.customizers = customizers == null ? List.of() : List.copyOf(customizers);
        this.steps = List.<FilterStep>of(
            FilterDimension.AUTHOR_EMAIL,
            FilterDimension.AUTHOR_URL,
            FilterDimension.USER_ID,
            FilterDimension.AUTHOR_IN,
            FilterDimension.AUTHOR_NOT_IN,
            FilterDimension.COMMENT_IN,
            FilterDimension.COMMENT_NOT_IN,
            this::applyDateQuery,
            FilterDimension.KARMA,
            this::applyMetaQuery,
            this::applyParent,
            FilterDimension.PARENT_IN,
            FilterDimension.PARENT_NOT_IN,
            FilterDimension.POST_AUTHOR,
            FilterDimension.POST_AUTHOR_IN,
            FilterDimension.POST_AUTHOR_NOT_IN,
            FilterDimension.POST_ID,
            FilterDimension.POST_IN,
            FilterDimension.POST_NOT_IN,
            FilterDimension.POST_STATUS,
            FilterDimension.POST_TYPE,
            FilterDimension.POST_NAME,
            FilterDimension.POST_PARENT,
            this::applyStatus,
            FilterDimension.TYPE,
            FilterDimension.TYPE_IN,
            FilterDimension.TYPE_NOT_IN
        );
    }

    public Map<String, Object> compileBody(FilterRequest request) {
        FilterRequest vars = request == null ? FilterRequest.empty() : request;
        Map<String, Object> body = compile(vars).toDsl();
        for (CommentQueryCustomizer customizer : customizers) {
            body = customizer.body(body, vars);
        }
        return body;
    }

    public CompiledQuery compile(FilterRequest request) {
        if (request == null) {
            request = FilterRequest.empty();
        }
        long size = resolveSize(request);
        long from = resolveFrom(request, size);
        List<SortClause> sort = resolveSort(request);
        List<String> sourceIncludes = "ids".equals(request.get("fields")) ? List.of(ID_FIELD) : null;

        FilterAccumulator filter = new FilterAccumulator();
        for (FilterStep step : steps) {
            step.apply(request, filter);
        }

        Map<String, Object> query = relevanceQueryBuilder.hasSearchTerm(request)
            ? relevanceQueryBuilder.build(request)
            : QueryDsl.matchAll();

        CompiledQuery compiled = new CompiledQuery(
            from,
            size,
            sort,
            sourceIncludes,
            query,
            filter.isEmpty() ? null : filter.toPostFilter()
        );
        if (log.isDebugEnabled()) {
            log.debug("compiled comment query from={} size={} sort={} filters={}", from, size, sort, filter.size());
        }
        return compiled;
    }

    long resolveSize(FilterRequest request) {
        if (!request.isEmpty("number")) {
            return Math.max(0L, request.getLong("number"));
        }
        return properties.getMaxResultWindow();
    }

    // A zero offset counts as not given, so a page above one still derives it.
    long resolveFrom(FilterRequest request, long size) {
        long from = 0L;
        if (request.isSet("offset")) {
            from = request.getLong("offset");
        }
        Object paged = request.first("paged", "page");
        if (paged != null && request.isEmpty("offset")) {
            long page = QueryVars.toLong(paged);
            if (page > 1) {
                from = pageOffset(size, page);
            }
        }
        return Math.max(0L, from);
    }

    private static long pageOffset(long size, long page) {
        try {
            return Math.multiplyExact(size, page - 1);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private List<SortClause> resolveSort(FilterRequest request) {
        SortDirection direction = SortDirection.from(request.get("order"));
        Object orderBy = request.first("orderby", "order_by");
        String alias = QueryVars.isEmpty(orderBy) ? DEFAULT_ORDER_BY : QueryVars.asString(orderBy);
        return sortKeyResolver.resolve(alias, direction, request);
    }

    private void applyDateQuery(FilterRequest request, FilterAccumulator filter) {
        Object dateQuery = request.get("date_query");
        if (QueryVars.isEmpty(dateQuery)) {
            return;
        }
        Map<String, Object> dateFilter = dateRangeFilterCompiler.compile(dateQuery);
        if (dateFilter == null || dateFilter.isEmpty()) {
            return;
        }
        if (dateFilter.containsKey(DateRangeFilterCompiler.AND)) {
            filter.add(ClausePlacement.FLAT, dateFilter.get(DateRangeFilterCompiler.AND));
        } else {
            log.debug("date filter without '{}' fragment ignored, keys={}", DateRangeFilterCompiler.AND, dateFilter.keySet());
        }
    }

    private void applyMetaQuery(FilterRequest request, FilterAccumulator filter) {
        List<Map<String, Object>> clauses = new ArrayList<>();
        String relation = null;

        if (!request.isEmpty("meta_key")) {
            Map<String, Object> shorthand = new LinkedHashMap<>();
            shorthand.put("key", request.get("meta_key"));
            if (request.isSet("meta_value")) {
                shorthand.put("value", request.get("meta_value"));
            }
            clauses.add(shorthand);
        }

        Object metaQuery = request.get("meta_query");
        if (!QueryVars.isEmpty(metaQuery)) {
            if (metaQuery instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if ("relation".equals(entry.getKey())) {
                        relation = QueryVars.asString(entry.getValue());
                    } else {
                        addMetaClause(entry.getValue(), clauses);
                    }
                }
            } else {
                for (Object item : QueryVars.toList(metaQuery)) {
                    addMetaClause(item, clauses);
                }
            }
        }

        if (clauses.isEmpty()) {
            return;
        }
        Map<String, Object> built = metaQueryCompiler.compile(new MetaQuery(relation, clauses));
        if (built != null && !built.isEmpty()) {
            filter.add(ClausePlacement.FLAT, built);
        }
    }

    @SuppressWarnings("unchecked")
    private void addMetaClause(Object item, List<Map<String, Object>> clauses) {
        if (item instanceof Map<?, ?> clause) {
            clauses.add((Map<String, Object>) clause);
        }
    }

    private void applyParent(FilterRequest request, FilterAccumulator filter) {
        Object parent = request.get("parent");
        if (!request.isEmpty("hierarchical") && QueryVars.isEmpty(parent)) {
            parent = 0;
        }
        FilterDimension.PARENT.applyValue(parent, filter);
    }

    private void applyStatus(FilterRequest request, FilterAccumulator filter) {
        Object status = request.get("status");
        if (QueryVars.isEmpty(status) || ModerationStatus.ALL.equals(status)) {
            return;
        }
        List<Object> statuses = ModerationStatus.encode(QueryVars.splitAndTrim(status));
        Map<String, Object> statusClause = QueryDsl.termOrTerms(APPROVED_FIELD, statuses);

        if (request.isEmpty("include_unapproved")) {
            filter.add(ClausePlacement.FLAT, statusClause);
            return;
        }
        UnapprovedIdentifiers unapproved = UnapprovedIdentifiers.parse(request.get("include_unapproved"));
        filter.addShould(List.of(
            statusClause,
            QueryDsl.terms(USER_ID_FIELD, unapproved.getUserIds()),
            QueryDsl.terms(AUTHOR_EMAIL_FIELD, unapproved.getEmails())
        ));
    }
}
