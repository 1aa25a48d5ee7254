package com.csl.commentquery.compile;

import com.csl.commentquery.dsl.QueryDsl;
import com.csl.commentquery.request.FilterRequest;
import com.csl.commentquery.request.QueryVars;
import java.util.Map;

public enum FilterDimension implements FilterStep {
    AUTHOR_EMAIL("author_email", "comment_author_email.raw", ClauseShape.TERM, ClausePlacement.FLAT),
    AUTHOR_URL("author_url", "comment_author_url.raw", ClauseShape.TERM, ClausePlacement.FLAT),
    USER_ID("user_id", "user_id", ClauseShape.TERM, ClausePlacement.FLAT, true, false, null),
    AUTHOR_IN("author__in", "user_id", ClauseShape.TERMS, ClausePlacement.MUST),
    AUTHOR_NOT_IN("author__not_in", "user_id", ClauseShape.TERMS, ClausePlacement.MUST_NOT),
    COMMENT_IN("comment__in", "comment_ID", ClauseShape.TERMS, ClausePlacement.MUST),
    COMMENT_NOT_IN("comment__not_in", "comment_ID", ClauseShape.TERMS, ClausePlacement.MUST_NOT),
    KARMA("karma", "comment_karma", ClauseShape.TERM, ClausePlacement.MUST, false, true, null),
    PARENT("parent", "comment_parent", ClauseShape.TERM, ClausePlacement.MUST, true, true, null),
    PARENT_IN("parent__in", "comment_parent", ClauseShape.TERMS, ClausePlacement.MUST),
    PARENT_NOT_IN("parent__not_in", "comment_parent", ClauseShape.TERMS, ClausePlacement.MUST_NOT),
    POST_AUTHOR("post_author", "comment_post_author_ID", ClauseShape.TERM, ClausePlacement.MUST, true, false, null),
    POST_AUTHOR_IN("post_author__in", "comment_post_author_ID", ClauseShape.TERMS, ClausePlacement.MUST),
    POST_AUTHOR_NOT_IN("post_author__not_in", "comment_post_author_ID", ClauseShape.TERMS, ClausePlacement.MUST_NOT),
    POST_ID("post_id", "comment_post_ID", ClauseShape.TERM, ClausePlacement.MUST, true, false, null),
    POST_IN("post__in", "comment_post_ID", ClauseShape.TERMS, ClausePlacement.MUST),
    POST_NOT_IN("post__not_in", "comment_post_ID", ClauseShape.TERMS, ClausePlacement.MUST_NOT),
    POST_STATUS("post_status", "comment_post_status", ClauseShape.MULTI, ClausePlacement.FLAT, false, false, "any"),
    POST_TYPE("post_type", "comment_post_type", ClauseShape.TERM, ClausePlacement.MUST),
    POST_NAME("post_name", "comment_post_name", ClauseShape.TERM, ClausePlacement.MUST),
    POST_PARENT("post_parent", "comment_post_parent", ClauseShape.TERM, ClausePlacement.MUST, true, false, null),
    TYPE("type", "comment_type.raw", ClauseShape.MULTI, ClausePlacement.FLAT),
    TYPE_IN("type__in", "comment_type.raw", ClauseShape.TERMS, ClausePlacement.MUST),
    TYPE_NOT_IN("type__not_in", "comment_type.raw", ClauseShape.TERMS, ClausePlacement.MUST_NOT);

    private final String param;
    private final String field;
    private final ClauseShape shape;
    private final ClausePlacement placement;
    private final boolean castToLong;
    private final boolean zeroActivates;
    private final String disabledLiteral;

    FilterDimension(String param, String field, ClauseShape shape, ClausePlacement placement) {
        this(param, field, shape, placement, false, false, null);
    }

    FilterDimension(
        String param,
        String field,
        ClauseShape shape,
        ClausePlacement placement,
        boolean castToLong,
        boolean zeroActivates,
        String disabledLiteral
    ) {
        this.param = param;
        this.field = field;
        this.shape = shape;
        this.placement = placement;
        this.castToLong = castToLong;
        this.zeroActivates = zeroActivates;
        this.disabledLiteral = disabledLiteral;
    }

    public String param() {
        return param;
    }

    public String field() {
        return field;
    }

    @Override
    public void apply(FilterRequest request, FilterAccumulator filter) {
        applyValue(request.get(param), filter);
    }

    public void applyValue(Object raw, FilterAccumulator filter) {
        if (!isActive(raw)) {
            return;
        }
        Map<String, Object> clause = switch (shape) {
            case TERM -> QueryDsl.term(field, castToLong ? QueryVars.toLong(raw) : raw);
            case TERMS -> QueryDsl.terms(field, QueryVars.toList(raw));
            case MULTI -> QueryDsl.termOrTerms(field, QueryVars.splitAndTrim(raw));
        };
        filter.add(placement, clause);
    }

    private boolean isActive(Object raw) {
        if (disabledLiteral != null && disabledLiteral.equals(raw)) {
            return false;
        }
        return !QueryVars.isEmpty(raw) || (zeroActivates && QueryVars.isIntegerZero(raw));
    }
}
