package com.csl.commentquery.dsl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class QueryDsl {
    private QueryDsl() {
    }

    public static Map<String, Object> single(String key, Object value) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put(key, value);
        return node;
    }

    public static Map<String, Object> term(String field, Object value) {
        return single("term", single(field, value));
    }

    public static Map<String, Object> terms(String field, List<?> values) {
        return single("terms", single(field, values));
    }

    public static Map<String, Object> termOrTerms(String field, List<?> values) {
        if (values.size() < 2) {
            return term(field, values.isEmpty() ? null : values.get(0));
        }
        return terms(field, values);
    }

    public static Map<String, Object> bool(String occur, Object clauses) {
        return single("bool", single(occur, clauses));
    }

    public static Map<String, Object> matchAll() {
        return single("match_all", single("boost", 1));
    }

    public static Object number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }
}
