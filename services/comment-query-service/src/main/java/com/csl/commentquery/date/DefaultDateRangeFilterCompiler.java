package com.csl.commentquery.date;

import com.csl.commentquery.dsl.QueryDsl;
import com.csl.commentquery.request.QueryVars;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DefaultDateRangeFilterCompiler implements DateRangeFilterCompiler {
    private static final Logger log = LoggerFactory.getLogger(DefaultDateRangeFilterCompiler.class);

    static final String DEFAULT_COLUMN = "comment_date";
    static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Set<String> COLUMNS = Set.of("comment_date", "comment_date_gmt");
    private static final Set<String> CLAUSE_KEYS = Set.of(
        "after", "before", "year", "month", "monthnum", "day", "column", "inclusive"
    );

    @Override
    public Map<String, Object> compile(Object dateQuery) {
        if (QueryVars.isEmpty(dateQuery)) {
            return Map.of();
        }
        String relation = null;
        List<Map<?, ?>> clauses = new ArrayList<>();
        if (dateQuery instanceof Map<?, ?> map) {
            Object rawRelation = map.get("relation");
            relation = rawRelation == null ? null : rawRelation.toString();
            if (isClause(map)) {
                clauses.add(map);
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!CLAUSE_KEYS.contains(String.valueOf(entry.getKey())) && entry.getValue() instanceof Map<?, ?> nested) {
                    clauses.add(nested);
                }
            }
        } else {
            for (Object item : QueryVars.toList(dateQuery)) {
                if (item instanceof Map<?, ?> nested) {
                    clauses.add(nested);
                }
            }
        }

        List<Object> ranges = new ArrayList<>();
        for (Map<?, ?> clause : clauses) {
            Map<String, Object> range = compileClause(clause);
            if (range != null) {
                ranges.add(range);
            }
        }
        if (ranges.isEmpty()) {
            return Map.of();
        }
        if (relation != null && "OR".equalsIgnoreCase(relation.trim())) {
            return QueryDsl.single(OR, QueryDsl.bool("should", ranges));
        }
        return QueryDsl.single(AND, QueryDsl.bool("must", ranges));
    }

    private boolean isClause(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (CLAUSE_KEYS.contains(String.valueOf(key))) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> compileClause(Map<?, ?> clause) {
        String column = QueryVars.asString(clause.get("column"));
        if (!COLUMNS.contains(column)) {
            column = DEFAULT_COLUMN;
        }
        boolean inclusive = !QueryVars.isEmpty(clause.get("inclusive"));

        Map<String, Object> bounds = new LinkedHashMap<>();
        String after = boundary(clause.get("after"), false);
        if (after != null) {
            bounds.put(inclusive ? "gte" : "gt", after);
        }
        String before = boundary(clause.get("before"), true);
        if (before != null) {
            bounds.put(inclusive ? "lte" : "lt", before);
        }
        if (bounds.isEmpty()) {
            Object month = clause.get("month") != null ? clause.get("month") : clause.get("monthnum");
            LocalDateTime[] window = window(clause.get("year"), month, clause.get("day"));
            if (window != null) {
                bounds.put("gte", FORMAT.format(window[0]));
                bounds.put("lte", FORMAT.format(window[1]));
            }
        }
        if (bounds.isEmpty()) {
            log.debug("date clause without usable bounds skipped: {}", clause);
            return null;
        }
        return QueryDsl.single("range", QueryDsl.single(column, bounds));
    }

    private String boundary(Object raw, boolean upper) {
        if (QueryVars.isEmpty(raw)) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> parts)) {
            return QueryVars.asString(raw);
        }
        LocalDateTime[] window = window(parts.get("year"), parts.get("month"), parts.get("day"));
        if (window == null) {
            return null;
        }
        return FORMAT.format(upper ? window[1] : window[0]);
    }

    private LocalDateTime[] window(Object rawYear, Object rawMonth, Object rawDay) {
        int year = QueryVars.toInt(rawYear);
        if (year <= 0 || year > 9999) {
            return null;
        }
        int month = QueryVars.toInt(rawMonth);
        int day = QueryVars.toInt(rawDay);
        if (month < 1 || month > 12) {
            return new LocalDateTime[] {
                LocalDateTime.of(year, 1, 1, 0, 0, 0),
                LocalDateTime.of(year, 12, 31, 23, 59, 59)
            };
        }
        YearMonth yearMonth = YearMonth.of(year, month);
        if (day < 1 || day > yearMonth.lengthOfMonth()) {
            return new LocalDateTime[] {
                yearMonth.atDay(1).atStartOfDay(),
                yearMonth.atEndOfMonth().atTime(23, 59, 59)
            };
        }
        return new LocalDateTime[] {
            yearMonth.atDay(day).atStartOfDay(),
            yearMonth.atDay(day).atTime(23, 59, 59)
        };
    }
}
