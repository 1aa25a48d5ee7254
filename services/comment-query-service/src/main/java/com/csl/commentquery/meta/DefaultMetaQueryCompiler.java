package com.csl.commentquery.meta;

import com.csl.commentquery.dsl.QueryDsl;
import com.csl.commentquery.request.QueryVars;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DefaultMetaQueryCompiler implements MetaQueryCompiler {
    private static final Logger log = LoggerFactory.getLogger(DefaultMetaQueryCompiler.class);

    @Override
    public Map<String, Object> compile(MetaQuery metaQuery) {
        if (metaQuery == null || metaQuery.isEmpty()) {
            return Map.of();
        }
        List<Object> compiled = new ArrayList<>();
        for (Map<String, Object> clause : metaQuery.getClauses()) {
            Map<String, Object> built = compileClause(clause);
            if (built != null) {
                compiled.add(built);
            }
        }
        if (compiled.isEmpty()) {
            return Map.of();
        }
        return QueryDsl.bool(metaQuery.isOr() ? "should" : "must", compiled);
    }

    private Map<String, Object> compileClause(Map<String, Object> clause) {
        if (clause == null) {
            return null;
        }
        String key = QueryVars.asString(clause.get("key"));
        if (key.isEmpty()) {
            log.debug("meta clause without key skipped: {}", clause);
            return null;
        }
        Object value = clause.get("value");
        MetaCompare compare = MetaCompare.from(clause.get("compare"), value != null);
        if (compare == null) {
            log.debug("unsupported meta compare '{}' for key {}", clause.get("compare"), key);
            return null;
        }
        String base = "meta." + key;
        String typed = base + "." + MetaType.from(clause.get("type")).subField();

        return switch (compare) {
            case EQUALS -> QueryDsl.term(typed, value);
            case NOT_EQUALS -> mustNot(QueryDsl.term(typed, value));
            case IN -> QueryDsl.terms(typed, QueryVars.toList(value));
            case NOT_IN -> mustNot(QueryDsl.terms(typed, QueryVars.toList(value)));
            case GREATER -> range(typed, "gt", value);
            case GREATER_OR_EQUAL -> range(typed, "gte", value);
            case LESS -> range(typed, "lt", value);
            case LESS_OR_EQUAL -> range(typed, "lte", value);
            case BETWEEN -> between(typed, value);
            case NOT_BETWEEN -> mustNot(between(typed, value));
            case LIKE -> QueryDsl.single("match", QueryDsl.single(base + ".value", value));
            case NOT_LIKE -> mustNot(QueryDsl.single("match", QueryDsl.single(base + ".value", value)));
            case EXISTS -> QueryDsl.single("exists", QueryDsl.single("field", base));
            case NOT_EXISTS -> mustNot(QueryDsl.single("exists", QueryDsl.single("field", base)));
        };
    }

    private Map<String, Object> range(String field, String operator, Object value) {
        return QueryDsl.single("range", QueryDsl.single(field, QueryDsl.single(operator, value)));
    }

    private Map<String, Object> between(String field, Object value) {
        List<Object> bounds = QueryVars.toList(value);
        if (bounds.size() < 2) {
            log.debug("BETWEEN on {} needs two bounds, got {}", field, bounds);
            return null;
        }
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("gte", bounds.get(0));
        range.put("lte", bounds.get(1));
        return QueryDsl.single("range", QueryDsl.single(field, range));
    }

    private Map<String, Object> mustNot(Map<String, Object> clause) {
        if (clause == null) {
            return null;
        }
        return QueryDsl.bool("must_not", clause);
    }
}
