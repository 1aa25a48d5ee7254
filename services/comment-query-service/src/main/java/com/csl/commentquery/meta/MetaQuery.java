package com.csl.commentquery.meta;

import java.util.List;
import java.util.Map;

public final class MetaQuery {
    private final String relation;
    private final List<Map<String, Object>> clauses;

    public MetaQuery(String relation, List<Map<String, Object>> clauses) {
        this.relation = relation;
        this.clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }

    public String getRelation() {
        return relation;
    }

    public List<Map<String, Object>> getClauses() {
        return clauses;
    }

    public boolean isOr() {
        return relation != null && "OR".equalsIgnoreCase(relation.trim());
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }
}
